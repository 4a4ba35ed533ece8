package org.javai.pimlico.text;

/**
 * A recoverable problem found in a grammar source.
 * <p>
 * Syntax errors are appended to a caller-owned list while parsing continues; they are
 * never thrown. The list order is the order in which problems were discovered.
 *
 * @param message human-readable description of the problem
 * @param position where the problem was found
 * @param line the text of the source line holding {@code position}, without its line break
 */
public record SyntaxError(String message, Position position, String line) {

	/**
	 * Creates an error at the buffer's current position.
	 */
	public static SyntaxError at(String message, TextBuffer buffer) {
		return at(message, buffer.position(), buffer);
	}

	/**
	 * Creates an error at an earlier position of the buffer.
	 */
	public static SyntaxError at(String message, Position position, TextBuffer buffer) {
		return new SyntaxError(message, position, buffer.lineText(position.line()));
	}

	/**
	 * Renders the error with the offending source line and a caret under its column.
	 */
	public String format() {
		StringBuilder sb = new StringBuilder();
		sb.append(position).append(": ").append(message).append('\n');
		sb.append(line).append('\n');
		sb.append(" ".repeat(Math.max(0, position.column() - 1))).append('^');
		return sb.toString();
	}

	@Override
	public String toString() {
		return "[" + position + "] " + message;
	}
}
