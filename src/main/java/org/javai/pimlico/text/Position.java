package org.javai.pimlico.text;

/**
 * A location in a grammar source.
 *
 * @param offset zero-based character offset into the (normalised) source text
 * @param line one-based line number
 * @param column one-based column number
 */
public record Position(int offset, int line, int column) {

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
