package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for a character or token that cannot appear where it was found.
 */
public class UnexpectedTokenException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public UnexpectedTokenException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
