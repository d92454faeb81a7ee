package de.tu_berlin.coga.lpreader.model;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A constraint row <code>expression sense rhs</code>. The expression holds all
 * variables and no constant.
 */
public final class Constraint {
	private final LinearExpression expression;
	private final Sense sense;
	private final double rhs;

	public Constraint(LinearExpression expression, Sense sense, double rhs) {
		Preconditions.checkNotNull(expression);
		Preconditions.checkArgument(expression.constant() == 0, "constraint expression must not carry a constant");
		this.expression = expression;
		this.sense = Preconditions.checkNotNull(sense);
		this.rhs = rhs;
	}

	/**
	 * Builds the row for <code>left sense right</code>: variables of the right
	 * side move to the left, constants of the left side move to the right.
	 */
	public static Constraint normalize(LinearExpression left, Sense sense, LinearExpression right) {
		LinearExpression difference = left.minus(right);
		return new Constraint(difference.withoutConstant(), sense, 0 - difference.constant());
	}

	public LinearExpression expression() {
		return expression;
	}

	public Sense sense() {
		return sense;
	}

	public double rhs() {
		return rhs;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Constraint)) {
			return false;
		}
		Constraint other = (Constraint) obj;
		return sense == other.sense && Double.compare(rhs, other.rhs) == 0 && expression.equals(other.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(expression, sense, rhs);
	}

	@Override
	public String toString() {
		return expression + " " + sense.symbol() + " " + rhs;
	}
}
