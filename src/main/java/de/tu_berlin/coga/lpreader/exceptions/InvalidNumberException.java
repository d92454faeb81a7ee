package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for a numeric literal not of the form <code>digits[.digits]</code>.
 */
public class InvalidNumberException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public InvalidNumberException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
