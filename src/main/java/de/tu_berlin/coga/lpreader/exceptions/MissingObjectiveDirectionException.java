package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown when the first statement does not start with <code>max:</code> or
 * <code>min:</code>.
 */
public class MissingObjectiveDirectionException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public MissingObjectiveDirectionException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
