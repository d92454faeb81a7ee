package de.tu_berlin.coga.lpreader.model;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A linear program as read from an <code>.lp</code> file: one objective, the
 * constraint rows in file order and the declarations of all variables in order
 * of first appearance.
 * 
 * Instances are immutable and can be shared between threads.
 */
public final class Model {
	private final Objective objective;
	private final ImmutableList<Constraint> constraints;
	private final ImmutableMap<String, VariableDeclaration> variables;

	public Model(Objective objective, ImmutableList<Constraint> constraints,
			ImmutableMap<String, VariableDeclaration> variables) {
		this.objective = Preconditions.checkNotNull(objective);
		this.constraints = Preconditions.checkNotNull(constraints);
		this.variables = Preconditions.checkNotNull(variables);
	}

	public Objective objective() {
		return objective;
	}

	public ImmutableList<Constraint> constraints() {
		return constraints;
	}

	/**
	 * Tells the declarations of all variables, keyed by name, in order of first
	 * appearance.
	 */
	public ImmutableMap<String, VariableDeclaration> variables() {
		return variables;
	}

	/**
	 * Tells the names of all variables in order of first appearance.
	 */
	public ImmutableList<String> variableNames() {
		return variables.keySet().asList();
	}

	/**
	 * Tells the declaration of a variable.
	 * 
	 * @throws IllegalArgumentException
	 *           if the model has no such variable
	 */
	public VariableDeclaration variable(String name) {
		VariableDeclaration declaration = variables.get(name);
		Preconditions.checkArgument(declaration != null, "unknown variable '%s'", name);
		return declaration;
	}

	public int noOfVariables() {
		return variables.size();
	}

	public int noOfConstraints() {
		return constraints.size();
	}

	/**
	 * Hands the model to a solver adapter: first all variables in order of first
	 * appearance, then the constraints in file order, finally the objective.
	 */
	public void exportTo(SolverAdapter adapter) {
		Preconditions.checkNotNull(adapter);
		for (VariableDeclaration declaration : variables.values()) {
			adapter.addVariable(declaration);
		}
		for (Constraint constraint : constraints) {
			adapter.addConstraint(constraint);
		}
		adapter.setObjective(objective);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Model)) {
			return false;
		}
		Model other = (Model) obj;
		return objective.equals(other.objective) && constraints.equals(other.constraints)
				&& variables.equals(other.variables) && variableNames().equals(other.variableNames());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(objective, constraints, variables);
	}

	@Override
	public String toString() {
		StringBuilder strBuilder = new StringBuilder();
		strBuilder.append(objective).append(";\n");
		for (Constraint constraint : constraints) {
			strBuilder.append(constraint).append(";\n");
		}
		for (VariableDeclaration declaration : variables.values()) {
			strBuilder.append("// ").append(declaration).append('\n');
		}
		return strBuilder.toString();
	}
}
