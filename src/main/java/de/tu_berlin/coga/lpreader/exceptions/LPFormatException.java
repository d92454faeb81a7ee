package de.tu_berlin.coga.lpreader.exceptions;

import java.text.ParseException;

import de.tu_berlin.coga.lpreader.Statement;

/**
 * Base class of all errors raised while reading an <code>.lp</code> file.
 * 
 * The error offset reported by {@link #getErrorOffset()} is the line on which
 * the offending statement starts. Reading never recovers from one of these: a
 * single malformed statement fails the whole file.
 */
public class LPFormatException extends ParseException {
	private static final long serialVersionUID = 1L;

	private final int statementIndex;
	private final String statementText;
	private final String offendingToken;

	/**
	 * @param message
	 *          what went wrong
	 * @param statement
	 *          the statement being read when the error occurred
	 * @param offendingToken
	 *          the token that triggered the error, may be <code>null</code>
	 */
	public LPFormatException(String message, Statement statement, String offendingToken) {
		super(describe(message, statement, offendingToken), statement.lineNo());
		this.statementIndex = statement.index();
		this.statementText = statement.text();
		this.offendingToken = offendingToken;
	}

	private static String describe(String message, Statement statement, String offendingToken) {
		StringBuilder strBuilder = new StringBuilder();
		strBuilder.append("line ").append(statement.lineNo());
		strBuilder.append(", statement ").append(statement.index());
		strBuilder.append(": ").append(message);
		if (offendingToken != null) {
			strBuilder.append(" at '").append(offendingToken).append('\'');
		}
		return strBuilder.toString();
	}

	/**
	 * Tells the 1-based index of the offending statement.
	 */
	public int getStatementIndex() {
		return statementIndex;
	}

	/**
	 * Tells the text of the offending statement, comments removed.
	 */
	public String getStatementText() {
		return statementText;
	}

	/**
	 * Tells the token that triggered the error.
	 * 
	 * @return the token or <code>null</code> if the statement as a whole is at
	 *         fault
	 */
	public String getOffendingToken() {
		return offendingToken;
	}
}
