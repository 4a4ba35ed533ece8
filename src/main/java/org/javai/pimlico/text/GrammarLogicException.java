package org.javai.pimlico.text;

/**
 * Signals a state the parser guarantees can never be reached on any input.
 * Unlike {@link SyntaxError}, this is never collected: it aborts the whole parse pass.
 */
public class GrammarLogicException extends RuntimeException {

	private final transient Position position;

	public GrammarLogicException(String message, Position position) {
		super(message + " at " + position);
		this.position = position;
	}

	public GrammarLogicException(String message, TextBuffer buffer) {
		this(message, buffer.position());
	}

	public Position position() {
		return position;
	}
}
