package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for an <code>int</code>, <code>bin</code> or <code>free</code>
 * declaration whose name list is empty or has empty entries.
 */
public class InvalidDeclarationException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public InvalidDeclarationException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
