package de.tu_berlin.coga.lpreader.model;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The objective of a linear program. The constant of the expression is the
 * objective offset.
 */
public final class Objective {
	private final ObjectiveGoal goal;
	private final LinearExpression expression;

	public Objective(ObjectiveGoal goal, LinearExpression expression) {
		this.goal = Preconditions.checkNotNull(goal);
		this.expression = Preconditions.checkNotNull(expression);
	}

	public ObjectiveGoal goal() {
		return goal;
	}

	public LinearExpression expression() {
		return expression;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Objective)) {
			return false;
		}
		Objective other = (Objective) obj;
		return goal == other.goal && expression.equals(other.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(goal, expression);
	}

	@Override
	public String toString() {
		return goal.keyword() + ": " + expression;
	}
}
