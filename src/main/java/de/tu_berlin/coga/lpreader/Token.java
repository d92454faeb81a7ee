package de.tu_berlin.coga.lpreader;

import com.google.common.base.Preconditions;

import de.tu_berlin.coga.lpreader.model.Sense;

/**
 * A token of a statement.
 */
public final class Token {
	private final TokenType type;
	private final String text;
	private final int offset;
	private final boolean attached;

	Token(TokenType type, String text, int offset, boolean attached) {
		this.type = Preconditions.checkNotNull(type);
		this.text = Preconditions.checkNotNull(text);
		this.offset = offset;
		this.attached = attached;
	}

	public TokenType type() {
		return type;
	}

	/**
	 * Tells the token text. Relational operators are given in their canonical
	 * spelling <code>&lt;=</code>, <code>&gt;=</code> or <code>=</code>.
	 */
	public String text() {
		return text;
	}

	/**
	 * Tells the position of the token within the scanned text.
	 */
	public int offset() {
		return offset;
	}

	/**
	 * Tells whether a sign is written directly in front of a number or
	 * identifier. Always <code>false</code> for other tokens.
	 */
	public boolean isAttached() {
		return attached;
	}

	public boolean isNegative() {
		return type == TokenType.SIGN && text.equals("-");
	}

	/**
	 * Tells the sense of a relational operator.
	 */
	public Sense sense() {
		Preconditions.checkState(type == TokenType.RELATIONAL, "not a relational operator: %s", text);
		if (text.equals("<=")) {
			return Sense.LEQ;
		} else if (text.equals(">=")) {
			return Sense.GEQ;
		}
		return Sense.EQ;
	}

	@Override
	public String toString() {
		return type + "(" + text + ")";
	}
}
