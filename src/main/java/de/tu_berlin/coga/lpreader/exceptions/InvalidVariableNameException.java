package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for an identifier not matching <code>[A-Za-z]+[A-Za-z0-9_]*</code>.
 */
public class InvalidVariableNameException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public InvalidVariableNameException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
