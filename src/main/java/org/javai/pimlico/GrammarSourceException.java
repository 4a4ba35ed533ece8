package org.javai.pimlico;

/**
 * Exception thrown when a grammar source or its options cannot be read.
 * Syntax problems inside a grammar are reported as diagnostics, not with this exception.
 */
public class GrammarSourceException extends RuntimeException {

	public GrammarSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
