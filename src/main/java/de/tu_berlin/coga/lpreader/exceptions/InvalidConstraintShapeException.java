package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for a constraint without exactly one relational operator, with an
 * empty side, or without any variable.
 */
public class InvalidConstraintShapeException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public InvalidConstraintShapeException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
