package de.tu_berlin.coga.lpreader.model;

/**
 * Receives a {@link Model} and maps it onto the variables, rows and objective
 * of some solver. See {@link Model#exportTo(SolverAdapter)} for the order of
 * calls.
 */
public interface SolverAdapter {

	/**
	 * Creates a solver variable with the given bounds and kind.
	 */
	void addVariable(VariableDeclaration declaration);

	/**
	 * Adds one row. Every variable of the row has been added before.
	 */
	void addConstraint(Constraint constraint);

	/**
	 * Sets direction, coefficients and offset of the objective.
	 */
	void setObjective(Objective objective);
}
