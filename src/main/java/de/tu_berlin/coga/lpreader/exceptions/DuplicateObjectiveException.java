package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/** Thrown for a second objective statement. */
public class DuplicateObjectiveException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public DuplicateObjectiveException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
