package org.javai.pimlico.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Character cursor over a grammar source.
 * <p>
 * Besides single-character lookahead and consumption, the buffer knows about lines and
 * their indentation, which is what the indentation-structured grammar language needs to
 * decide where a block of rules begins and ends. Indentation counts leading spaces only.
 * Windows line endings are normalised to {@code '\n'} on construction.
 */
public class TextBuffer {

	private final String text;
	private final int[] lineStarts;
	private int offset = 0;

	public TextBuffer(String text) {
		this.text = text != null ? text.replace("\r\n", "\n") : "";
		this.lineStarts = computeLineStarts(this.text);
	}

	/**
	 * Returns a snapshot of the cursor position.
	 */
	public Position position() {
		int index = lineIndexOf(offset);
		return new Position(offset, index + 1, offset - lineStarts[index] + 1);
	}

	/**
	 * Moves the cursor back (or forward) to a previously taken snapshot.
	 */
	public void restore(Position position) {
		Objects.requireNonNull(position, "position must not be null");
		if (position.offset() < 0 || position.offset() > text.length()) {
			throw new IllegalArgumentException("Position outside of buffer: " + position);
		}
		offset = position.offset();
	}

	public char peek() {
		return endReached() ? '\0' : text.charAt(offset);
	}

	public boolean peek(char expected) {
		return !endReached() && text.charAt(offset) == expected;
	}

	/**
	 * Consumes one character.
	 *
	 * @throws GrammarLogicException if the end of input has already been reached
	 */
	public char read() {
		if (endReached()) {
			throw new GrammarLogicException("read past end of input", position());
		}
		return text.charAt(offset++);
	}

	/**
	 * Consumes one character if it is the expected one.
	 */
	public boolean read(char expected) {
		if (peek(expected)) {
			offset++;
			return true;
		}
		return false;
	}

	/**
	 * Consumes a literal only when the input continues with exactly that text.
	 */
	public boolean read(String literal) {
		if (text.startsWith(literal, offset)) {
			offset += literal.length();
			return true;
		}
		return false;
	}

	/**
	 * Consumes the longest run of identifier characters ({@code [a-z_]}) at the cursor.
	 *
	 * @return the identifier, empty when the cursor is not on an identifier character
	 */
	public String readIdentifier() {
		int start = offset;
		while (!endReached() && isIdentifierChar(text.charAt(offset))) {
			offset++;
		}
		return text.substring(start, offset);
	}

	public static boolean isIdentifierChar(char c) {
		return (c >= 'a' && c <= 'z') || c == '_';
	}

	/**
	 * Skips spaces and tabs on the current line.
	 */
	public void skipSpace() {
		skipSpace(false);
	}

	/**
	 * Skips spaces and tabs, and line breaks as well when {@code newlines} is set.
	 */
	public void skipSpace(boolean newlines) {
		while (!endReached()) {
			char c = text.charAt(offset);
			if (c == ' ' || c == '\t' || (newlines && c == '\n')) {
				offset++;
			} else {
				break;
			}
		}
	}

	/**
	 * Advances to the line break ending the current line, or to the end of input.
	 */
	public void skipLine() {
		offset = lineEnd(lineIndexOf(offset) + 1);
	}

	public boolean endReached() {
		return offset >= text.length();
	}

	/**
	 * True at the end of input or directly in front of a line break.
	 */
	public boolean atLineEnd() {
		return endReached() || text.charAt(offset) == '\n';
	}

	/**
	 * Number of leading spaces on the line holding the cursor.
	 */
	public int indentation() {
		return indentation(lineIndexOf(offset) + 1);
	}

	/**
	 * Number of leading spaces on the given one-based line.
	 */
	public int indentation(int line) {
		int start = lineStart(line);
		int index = start;
		while (index < text.length() && text.charAt(index) == ' ') {
			index++;
		}
		return index - start;
	}

	/**
	 * Indentation of the next content line after the cursor's line, relative to the
	 * indentation of {@code referenceLine}. Blank lines are ignored and the end of input
	 * counts as a line with no indentation, so a positive result always means that a
	 * more deeply indented line follows.
	 */
	public int indentationDelta(int referenceLine) {
		int reference = indentation(referenceLine);
		int next = nextContentLine(lineIndexOf(offset) + 1);
		return (next > 0 ? indentation(next) : 0) - reference;
	}

	/**
	 * Block-skip recovery. Moves to the end of the current line, then past every
	 * following line that is blank or indented deeper than {@code indentation}. The
	 * cursor is left on the line break in front of the first line indented at most
	 * {@code indentation} spaces, or at the end of input. Repeating the call with the
	 * same argument does not move the cursor.
	 */
	public void skipBlock(int indentation) {
		int line = lineIndexOf(offset) + 1;
		offset = lineEnd(line);
		while (line < lineStarts.length) {
			int next = line + 1;
			if (!isBlank(next) && indentation(next) <= indentation) {
				break;
			}
			offset = lineEnd(next);
			line = next;
		}
	}

	/**
	 * Text of the given one-based line without its line break.
	 */
	public String lineText(int line) {
		return text.substring(lineStart(line), lineEnd(line));
	}

	public int lineCount() {
		return lineStarts.length;
	}

	private int nextContentLine(int afterLine) {
		for (int line = afterLine + 1; line <= lineStarts.length; line++) {
			if (!isBlank(line)) {
				return line;
			}
		}
		return -1;
	}

	private boolean isBlank(int line) {
		int end = lineEnd(line);
		for (int index = lineStart(line); index < end; index++) {
			char c = text.charAt(index);
			if (c != ' ' && c != '\t') {
				return false;
			}
		}
		return true;
	}

	private int lineStart(int line) {
		if (line < 1 || line > lineStarts.length) {
			throw new IllegalArgumentException("No such line: " + line);
		}
		return lineStarts[line - 1];
	}

	private int lineEnd(int line) {
		int end = text.indexOf('\n', lineStart(line));
		return end < 0 ? text.length() : end;
	}

	private int lineIndexOf(int index) {
		int found = Arrays.binarySearch(lineStarts, index);
		return found >= 0 ? found : -found - 2;
	}

	private static int[] computeLineStarts(String text) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int index = 0; index < text.length(); index++) {
			if (text.charAt(index) == '\n') {
				starts.add(index + 1);
			}
		}
		return starts.stream().mapToInt(Integer::intValue).toArray();
	}
}
