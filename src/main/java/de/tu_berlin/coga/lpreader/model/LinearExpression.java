package de.tu_berlin.coga.lpreader.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * A linear combination of named variables plus a constant.
 * 
 * Each variable appears at most once; the coefficients of repeated mentions
 * are summed by the {@link Builder}. Variables keep the order in which they
 * were first added.
 */
public final class LinearExpression {
	private static final LinearExpression EMPTY = new LinearExpression(ImmutableMap.<String, Double> of(), 0);

	private final ImmutableMap<String, Double> coefficients;
	private final double constant;

	private LinearExpression(ImmutableMap<String, Double> coefficients, double constant) {
		this.coefficients = coefficients;
		this.constant = constant;
	}

	/**
	 * Tells the expression without any variable and a zero constant.
	 */
	public static LinearExpression empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Tells the coefficients of the variables in order of first appearance.
	 */
	public ImmutableMap<String, Double> coefficients() {
		return coefficients;
	}

	/**
	 * Tells the coefficient of a variable.
	 * 
	 * @return the coefficient or <code>0</code> if the variable does not occur
	 */
	public double coefficient(String variable) {
		Double value = coefficients.get(variable);
		return (value == null) ? 0 : value.doubleValue();
	}

	public double constant() {
		return constant;
	}

	/**
	 * Tells whether the expression mentions no variable at all.
	 */
	public boolean isConstant() {
		return coefficients.isEmpty();
	}

	/**
	 * Tells whether the expression is exactly one variable with coefficient
	 * <code>1</code> and no constant.
	 */
	public boolean isSingleVariable() {
		return coefficients.size() == 1 && constant == 0 && coefficients.values().iterator().next() == 1.0;
	}

	/**
	 * Subtracts another expression from this one. Variables of this expression
	 * come first, followed by those only present in <code>other</code>.
	 */
	public LinearExpression minus(LinearExpression other) {
		Preconditions.checkNotNull(other);
		Builder builder = builder().addConstant(constant - other.constant);
		for (Entry<String, Double> term : coefficients.entrySet()) {
			builder.addTerm(term.getKey(), term.getValue());
		}
		for (Entry<String, Double> term : other.coefficients.entrySet()) {
			builder.addTerm(term.getKey(), -term.getValue());
		}
		return builder.build();
	}

	/**
	 * Drops the constant.
	 */
	public LinearExpression withoutConstant() {
		return (constant == 0) ? this : new LinearExpression(coefficients, 0);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof LinearExpression)) {
			return false;
		}
		LinearExpression other = (LinearExpression) obj;
		return Double.compare(constant, other.constant) == 0 && coefficients.equals(other.coefficients);
	}

	@Override
	public int hashCode() {
		return 31 * coefficients.hashCode() + Double.hashCode(constant);
	}

	@Override
	public String toString() {
		StringBuilder strBuilder = new StringBuilder();
		for (Entry<String, Double> term : coefficients.entrySet()) {
			appendTerm(strBuilder, term.getValue(), term.getKey());
		}
		if (constant != 0 || strBuilder.length() == 0) {
			appendTerm(strBuilder, constant, null);
		}
		return strBuilder.toString();
	}

	private static void appendTerm(StringBuilder strBuilder, double value, String variable) {
		boolean first = strBuilder.length() == 0;
		if (value < 0) {
			strBuilder.append(first ? "-" : " - ");
		} else if (!first) {
			strBuilder.append(" + ");
		}
		double magnitude = Math.abs(value);
		if (variable == null) {
			strBuilder.append(magnitude);
		} else {
			if (magnitude != 1) {
				strBuilder.append(magnitude).append(' ');
			}
			strBuilder.append(variable);
		}
	}

	/**
	 * Accumulates terms into a {@link LinearExpression}.
	 */
	public static final class Builder {
		private final Map<String, Double> coefficients = new LinkedHashMap<String, Double>();
		private double constant;

		private Builder() {
		}

		/**
		 * Adds <code>coefficient &middot; variable</code>, summing with any
		 * earlier term of the same variable.
		 */
		public Builder addTerm(String variable, double coefficient) {
			Preconditions.checkNotNull(variable);
			Double previous = coefficients.get(variable);
			if (previous == null) {
				coefficients.put(variable, coefficient);
			} else {
				coefficients.put(variable, previous + coefficient);
			}
			return this;
		}

		public Builder addConstant(double value) {
			constant += value;
			return this;
		}

		public LinearExpression build() {
			if (coefficients.isEmpty() && constant == 0) {
				return EMPTY;
			}
			return new LinearExpression(ImmutableMap.copyOf(coefficients), constant);
		}
	}
}
