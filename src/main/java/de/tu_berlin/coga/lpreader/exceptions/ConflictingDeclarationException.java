package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown when a variable is declared again with a different kind.
 */
public class ConflictingDeclarationException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public ConflictingDeclarationException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
