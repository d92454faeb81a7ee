package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown when a term carries more than one detached or more than one attached
 * sign.
 */
public class TooManySignsException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public TooManySignsException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
