package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown when the input ends with text that is not terminated by <code>;</code>.
 */
public class MissingTerminatorException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public MissingTerminatorException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
