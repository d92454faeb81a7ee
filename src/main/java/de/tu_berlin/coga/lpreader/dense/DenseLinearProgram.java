package de.tu_berlin.coga.lpreader.dense;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

import com.google.common.base.Preconditions;

import de.tu_berlin.coga.lpreader.model.Constraint;
import de.tu_berlin.coga.lpreader.model.Model;
import de.tu_berlin.coga.lpreader.model.Objective;
import de.tu_berlin.coga.lpreader.model.ObjectiveGoal;
import de.tu_berlin.coga.lpreader.model.Sense;
import de.tu_berlin.coga.lpreader.model.SolverAdapter;
import de.tu_berlin.coga.lpreader.model.VariableDeclaration;

/**
 * A linear program in the dense form a simplex implementation works on:
 * constraint matrix, senses, right hand side, objective vector and bounds, all
 * indexed by the order in which variables and rows were added.
 * 
 * Fill it through the {@link SolverAdapter} methods, usually via
 * {@link #of(Model)}.
 */
public class DenseLinearProgram implements SolverAdapter {
	private final List<VariableDeclaration> variables = new ArrayList<VariableDeclaration>();
	private final Map<String, Integer> varIndex = new HashMap<String, Integer>();
	private final List<Constraint> rows = new ArrayList<Constraint>();
	private Objective objective;

	/**
	 * Assembles the dense form of a model.
	 */
	public static DenseLinearProgram of(Model model) {
		DenseLinearProgram program = new DenseLinearProgram();
		model.exportTo(program);
		return program;
	}

	@Override
	public void addVariable(VariableDeclaration declaration) {
		Preconditions.checkArgument(!varIndex.containsKey(declaration.name()), "variable '%s' added twice",
				declaration.name());
		varIndex.put(declaration.name(), variables.size());
		variables.add(declaration);
	}

	@Override
	public void addConstraint(Constraint constraint) {
		checkKnown(constraint.expression().coefficients().keySet());
		rows.add(constraint);
	}

	@Override
	public void setObjective(Objective objective) {
		checkKnown(objective.expression().coefficients().keySet());
		this.objective = objective;
	}

	private void checkKnown(Iterable<String> names) {
		for (String name : names) {
			Preconditions.checkArgument(varIndex.containsKey(name), "unknown variable '%s'", name);
		}
	}

	/**
	 * Tells the number of variables.
	 */
	public int noOfVariables() {
		return variables.size();
	}

	/**
	 * Tells the number of constraints.
	 */
	public int noOfConstraints() {
		return rows.size();
	}

	/**
	 * Tells the column of a variable.
	 * 
	 * @return the column or <code>-1</code> for an unknown variable
	 */
	public int indexOf(String name) {
		Integer index = varIndex.get(name);
		return (index == null) ? -1 : index.intValue();
	}

	public String variableName(int j) {
		return variables.get(j).name();
	}

	/**
	 * Tells the constraints coefficient matrix.
	 * 
	 * @return a new matrix of size <code>noOfConstraints()</code> &times;
	 *         <code>noOfVariables()</code>
	 */
	public DenseMatrix64F constraintsMatrix() {
		DenseMatrix64F matrix = new DenseMatrix64F(rows.size(), variables.size());
		for (int i = 0; i < rows.size(); i++) {
			for (Entry<String, Double> coeff : rows.get(i).expression().coefficients().entrySet()) {
				matrix.set(i, varIndex.get(coeff.getKey()), coeff.getValue());
			}
		}
		return matrix;
	}

	/**
	 * Tells the right hand side as a column vector.
	 */
	public DenseMatrix64F rhsVector() {
		DenseMatrix64F rhs = new DenseMatrix64F(rows.size(), 1);
		for (int i = 0; i < rows.size(); i++) {
			rhs.set(i, 0, rows.get(i).rhs());
		}
		return rhs;
	}

	/**
	 * Tells the senses of the constraints.
	 */
	public Sense[] senseVector() {
		Sense[] senses = new Sense[rows.size()];
		for (int i = 0; i < senses.length; i++) {
			senses[i] = rows.get(i).sense();
		}
		return senses;
	}

	/**
	 * Tells the objective coefficients as a row vector.
	 */
	public DenseMatrix64F objectiveVector() {
		checkObjective();
		DenseMatrix64F obj = new DenseMatrix64F(1, variables.size());
		for (Entry<String, Double> coeff : objective.expression().coefficients().entrySet()) {
			obj.set(0, varIndex.get(coeff.getKey()), coeff.getValue());
		}
		return obj;
	}

	public double objectiveOffset() {
		checkObjective();
		return objective.expression().constant();
	}

	public ObjectiveGoal objectiveGoal() {
		checkObjective();
		return objective.goal();
	}

	public double[] lowerBoundVector() {
		double[] lbound = new double[variables.size()];
		for (int j = 0; j < lbound.length; j++) {
			lbound[j] = variables.get(j).lowerBound();
		}
		return lbound;
	}

	public double[] upperBoundVector() {
		double[] ubound = new double[variables.size()];
		for (int j = 0; j < ubound.length; j++) {
			ubound[j] = variables.get(j).upperBound();
		}
		return ubound;
	}

	/**
	 * Tells which variables have to take integral values.
	 */
	public boolean[] integralityVector() {
		boolean[] integral = new boolean[variables.size()];
		for (int j = 0; j < integral.length; j++) {
			integral[j] = variables.get(j).isIntegral();
		}
		return integral;
	}

	/**
	 * Computes the left hand side of every constraint for a point.
	 * 
	 * @param x
	 *          values of the variables in column order
	 * @return <code>A x</code>
	 */
	public double[] rowActivities(double[] x) {
		checkPoint(x);
		if (rows.isEmpty() || variables.isEmpty()) {
			return new double[rows.size()];
		}
		DenseMatrix64F activities = new DenseMatrix64F(rows.size(), 1);
		CommonOps.mult(constraintsMatrix(), columnVector(x), activities);
		double[] result = new double[rows.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = activities.get(i, 0);
		}
		return result;
	}

	/**
	 * Computes the objective value of a point, offset included.
	 */
	public double objectiveValue(double[] x) {
		checkPoint(x);
		if (variables.isEmpty()) {
			return objectiveOffset();
		}
		DenseMatrix64F value = new DenseMatrix64F(1, 1);
		CommonOps.mult(objectiveVector(), columnVector(x), value);
		return value.get(0, 0) + objectiveOffset();
	}

	/**
	 * Tells whether a point satisfies all bounds and constraints.
	 * 
	 * @param tolerance
	 *          absolute violation accepted per bound and row
	 */
	public boolean isFeasible(double[] x, double tolerance) {
		Preconditions.checkArgument(tolerance >= 0);
		checkPoint(x);
		for (int j = 0; j < x.length; j++) {
			VariableDeclaration var = variables.get(j);
			if (x[j] < var.lowerBound() - tolerance || x[j] > var.upperBound() + tolerance)
				return false;
			if (var.isIntegral() && Math.abs(x[j] - Math.rint(x[j])) > tolerance)
				return false;
		}
		double[] activities = rowActivities(x);
		for (int i = 0; i < activities.length; i++) {
			double rhs = rows.get(i).rhs();
			switch (rows.get(i).sense()) {
			case LEQ:
				if (activities[i] > rhs + tolerance)
					return false;
				break;
			case GEQ:
				if (activities[i] < rhs - tolerance)
					return false;
				break;
			case EQ:
				if (Math.abs(activities[i] - rhs) > tolerance)
					return false;
				break;
			}
		}
		return true;
	}

	private void checkPoint(double[] x) {
		Preconditions.checkNotNull(x);
		Preconditions.checkArgument(x.length == variables.size(), "expected %s values but got %s", variables.size(),
				x.length);
	}

	private void checkObjective() {
		Preconditions.checkState(objective != null, "objective not set");
	}

	private static DenseMatrix64F columnVector(double[] vector) {
		DenseMatrix64F vectorMatrix = new DenseMatrix64F(vector.length, 1);
		for (int i = 0; i < vector.length; i++) {
			vectorMatrix.set(i, 0, vector[i]);
		}
		return vectorMatrix;
	}

	@Override
	public String toString() {
		StringBuilder strBuilder = new StringBuilder();
		if (objective != null) {
			String goal = (objective.goal() == ObjectiveGoal.MAX) ? "max" : "min";
			strBuilder.append(goal);
			strBuilder.append('\t');
			appendRow(strBuilder, objectiveVector(), 0);
			strBuilder.append("\n\n");
		}
		strBuilder.append("subject to:\n");

		DenseMatrix64F matrix = constraintsMatrix();
		for (int c = 0; c < rows.size(); c++) {
			strBuilder.append('C').append(c + 1);
			strBuilder.append(":\t");
			appendRow(strBuilder, matrix, c);
			strBuilder.append(" ");
			strBuilder.append(rows.get(c).sense().symbol());
			strBuilder.append(" ");
			strBuilder.append(rows.get(c).rhs());
			strBuilder.append('\n');
		}

		strBuilder.append("\nbounds:\n");
		for (VariableDeclaration var : variables) {
			strBuilder.append(var.lowerBound()).append(" <= ").append(var.name()).append(" <= ")
					.append(var.upperBound());
			strBuilder.append('\t').append(var.kind()).append('\n');
		}
		return strBuilder.toString();
	}

	private void appendRow(StringBuilder strBuilder, DenseMatrix64F matrix, int row) {
		for (int i = 0; i < variables.size(); i++) {
			if (matrix.get(row, i) != 0) {
				strBuilder.append(matrix.get(row, i));
				strBuilder.append('*');
				strBuilder.append(variables.get(i).name());
			}
			strBuilder.append('\t');
		}
	}
}
