package de.tu_berlin.coga.lpreader.model;

/**
 * Relational operator of a constraint.
 */
public enum Sense {
	LEQ("<="), EQ("="), GEQ(">=");

	private final String symbol;

	private Sense(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * Tells the sense obtained by swapping both sides of a constraint, i.e.
	 * <code>a &lt;= b</code> becomes <code>b &gt;= a</code>.
	 */
	public Sense mirrored() {
		switch (this) {
		case LEQ:
			return GEQ;
		case GEQ:
			return LEQ;
		default:
			return EQ;
		}
	}
}
