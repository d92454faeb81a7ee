package de.tu_berlin.coga.lpreader.model;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Bounds and kind of one decision variable.
 */
public final class VariableDeclaration {
	private final String name;
	private final double lowerBound;
	private final double upperBound;
	private final VariableKind kind;

	public VariableDeclaration(String name, double lowerBound, double upperBound, VariableKind kind) {
		this.name = Preconditions.checkNotNull(name);
		this.lowerBound = lowerBound;
		this.upperBound = upperBound;
		this.kind = Preconditions.checkNotNull(kind);
	}

	/**
	 * Tells the declaration of a variable that was never declared or bounded:
	 * continuous on <code>[0, +inf)</code>.
	 */
	public static VariableDeclaration defaultFor(String name) {
		return new VariableDeclaration(name, 0, Double.POSITIVE_INFINITY, VariableKind.CONTINUOUS);
	}

	public String name() {
		return name;
	}

	public double lowerBound() {
		return lowerBound;
	}

	public double upperBound() {
		return upperBound;
	}

	public VariableKind kind() {
		return kind;
	}

	/**
	 * Tells whether a solver has to treat the variable as integral.
	 */
	public boolean isIntegral() {
		return kind == VariableKind.INTEGER || kind == VariableKind.BINARY;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof VariableDeclaration)) {
			return false;
		}
		VariableDeclaration other = (VariableDeclaration) obj;
		return name.equals(other.name) && kind == other.kind && Double.compare(lowerBound, other.lowerBound) == 0
				&& Double.compare(upperBound, other.upperBound) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name, lowerBound, upperBound, kind);
	}

	@Override
	public String toString() {
		return name + ":[" + lowerBound + ", " + upperBound + "] " + kind;
	}
}
