package de.tu_berlin.coga.lpreader;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import de.tu_berlin.coga.lpreader.ParsedStatement.ConstraintStatement;
import de.tu_berlin.coga.lpreader.ParsedStatement.DeclarationStatement;
import de.tu_berlin.coga.lpreader.ParsedStatement.ObjectiveStatement;
import de.tu_berlin.coga.lpreader.exceptions.ConflictingDeclarationException;
import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.MissingObjectiveDirectionException;
import de.tu_berlin.coga.lpreader.model.Constraint;
import de.tu_berlin.coga.lpreader.model.LinearExpression;
import de.tu_berlin.coga.lpreader.model.Model;
import de.tu_berlin.coga.lpreader.model.Objective;
import de.tu_berlin.coga.lpreader.model.Sense;
import de.tu_berlin.coga.lpreader.model.VariableDeclaration;
import de.tu_berlin.coga.lpreader.model.VariableKind;

/**
 * Accumulates classified statements into a {@link Model}.
 * 
 * Variables are registered in order of first appearance and start out
 * continuous on <code>[0, +inf)</code>. A constraint comparing a single
 * variable (coefficient 1, no constant) with a constant only changes that
 * variable's bounds; a later bound of the same direction replaces an earlier
 * one. All other constraints become rows.
 */
public class ModelBuilder {
	private static final Logger LOGGER = LoggerFactory.getLogger(ModelBuilder.class);

	private final TermParser termParser = new TermParser();
	private final Map<String, Variable> varHash = new LinkedHashMap<String, Variable>();
	private final ImmutableList.Builder<Constraint> constraints = ImmutableList.builder();
	private Objective objective;
	private int noOfRows;

	private static class Variable {
		final String name;
		double lb;
		double ub;
		VariableKind kind;
		boolean declared;

		Variable(String name) {
			this.name = name;
			lb = 0;
			ub = Double.POSITIVE_INFINITY;
			kind = VariableKind.CONTINUOUS;
		}

		VariableDeclaration toDeclaration() {
			return new VariableDeclaration(name, lb, ub, kind);
		}
	}

	public void add(ParsedStatement parsed) throws LPFormatException {
		switch (parsed.kind()) {
		case OBJECTIVE:
			addObjective((ObjectiveStatement) parsed);
			break;
		case DECLARATION:
			addDeclaration((DeclarationStatement) parsed);
			break;
		case CONSTRAINT:
			addConstraint((ConstraintStatement) parsed);
			break;
		}
	}

	/**
	 * Tells the finished model.
	 * 
	 * @throws MissingObjectiveDirectionException
	 *           if no objective was added, i.e. the input had no statements
	 */
	public Model build() throws LPFormatException {
		if (objective == null)
			throw new MissingObjectiveDirectionException("no objective found", new Statement(1, 1, ""), null);
		ImmutableMap.Builder<String, VariableDeclaration> declarations = ImmutableMap.builder();
		for (Variable var : varHash.values()) {
			declarations.put(var.name, var.toDeclaration());
		}
		Model model = new Model(objective, constraints.build(), declarations.build());
		LOGGER.debug("{} constraints, {} variables", model.noOfConstraints(), model.noOfVariables());
		return model;
	}

	private void addObjective(ObjectiveStatement parsed) throws LPFormatException {
		LinearExpression expression = termParser.parse(parsed.statement(), parsed.terms());
		register(expression);
		objective = new Objective(parsed.goal(), expression);
		LOGGER.debug("objective {}", objective);
	}

	private void addDeclaration(DeclarationStatement parsed) throws LPFormatException {
		VariableKind kind = parsed.variableKind();
		for (String name : parsed.names()) {
			Variable var = lookup(name);
			if (var.declared) {
				if (var.kind != kind)
					throw new ConflictingDeclarationException("variable '" + name + "' already declared " + var.kind,
							parsed.statement(), name);
				continue;
			}
			var.declared = true;
			var.kind = kind;
			switch (kind) {
			case BINARY:
				var.lb = 0;
				var.ub = 1;
				break;
			case FREE:
				var.lb = Double.NEGATIVE_INFINITY;
				break;
			default:
				break;
			}
			LOGGER.debug("declared {} as {}", name, kind);
		}
	}

	private void addConstraint(ConstraintStatement parsed) throws LPFormatException {
		LinearExpression left = termParser.parse(parsed.statement(), parsed.left());
		LinearExpression right = termParser.parse(parsed.statement(), parsed.right());
		register(left);
		register(right);

		if (left.isSingleVariable() && right.isConstant()) {
			tightenBound(left, parsed.sense(), right.constant());
		} else if (right.isSingleVariable() && left.isConstant()) {
			tightenBound(right, parsed.sense().mirrored(), left.constant());
		} else {
			Constraint row = Constraint.normalize(left, parsed.sense(), right);
			constraints.add(row);
			++noOfRows;
			LOGGER.debug("row {}: {}", noOfRows, row);
		}
	}

	private void tightenBound(LinearExpression single, Sense sense, double bound) {
		Variable var = varHash.get(single.coefficients().keySet().iterator().next());
		switch (sense) {
		case LEQ:
			var.ub = bound;
			break;
		case GEQ:
			var.lb = bound;
			break;
		case EQ:
			var.lb = bound;
			var.ub = bound;
			break;
		}
		LOGGER.debug("bounds of {} now [{}, {}]", var.name, var.lb, var.ub);
	}

	private void register(LinearExpression expression) {
		for (String name : expression.coefficients().keySet()) {
			lookup(name);
		}
	}

	private Variable lookup(String name) {
		Variable var = varHash.get(name);
		if (var == null) {
			var = new Variable(name);
			varHash.put(name, var);
		}
		return var;
	}
}
