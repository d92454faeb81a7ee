package de.tu_berlin.coga.lpreader.exceptions;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Thrown for a comment that is not closed on the physical line it opens on.
 */
public class MalformedCommentException extends LPFormatException {
	private static final long serialVersionUID = 1L;

	public MalformedCommentException(String message, Statement statement, String offendingToken) {
		super(message, statement, offendingToken);
	}
}
