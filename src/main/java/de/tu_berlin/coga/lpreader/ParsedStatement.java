package de.tu_berlin.coga.lpreader;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.lpreader.model.ObjectiveGoal;
import de.tu_berlin.coga.lpreader.model.Sense;
import de.tu_berlin.coga.lpreader.model.VariableKind;

/**
 * A statement after classification: an objective, a declaration or a
 * constraint. Objectives and constraints keep the tokens of their linear
 * expressions for the {@link TermParser}.
 */
public abstract class ParsedStatement {
	public static enum Kind {
		OBJECTIVE, DECLARATION, CONSTRAINT
	}

	private final Statement statement;

	ParsedStatement(Statement statement) {
		this.statement = Preconditions.checkNotNull(statement);
	}

	public Statement statement() {
		return statement;
	}

	public abstract Kind kind();

	/**
	 * <code>max: ...</code> or <code>min: ...</code>
	 */
	public static final class ObjectiveStatement extends ParsedStatement {
		private final ObjectiveGoal goal;
		private final ImmutableList<Token> terms;

		ObjectiveStatement(Statement statement, ObjectiveGoal goal, ImmutableList<Token> terms) {
			super(statement);
			this.goal = goal;
			this.terms = terms;
		}

		@Override
		public Kind kind() {
			return Kind.OBJECTIVE;
		}

		public ObjectiveGoal goal() {
			return goal;
		}

		public ImmutableList<Token> terms() {
			return terms;
		}
	}

	/**
	 * <code>int ...</code>, <code>bin ...</code> or <code>free ...</code>
	 */
	public static final class DeclarationStatement extends ParsedStatement {
		private final VariableKind variableKind;
		private final ImmutableList<String> names;

		DeclarationStatement(Statement statement, VariableKind variableKind, ImmutableList<String> names) {
			super(statement);
			this.variableKind = variableKind;
			this.names = names;
		}

		@Override
		public Kind kind() {
			return Kind.DECLARATION;
		}

		public VariableKind variableKind() {
			return variableKind;
		}

		public ImmutableList<String> names() {
			return names;
		}
	}

	/**
	 * <code>[label:] left sense right</code>, the label already dropped.
	 */
	public static final class ConstraintStatement extends ParsedStatement {
		private final ImmutableList<Token> left;
		private final Sense sense;
		private final ImmutableList<Token> right;

		ConstraintStatement(Statement statement, ImmutableList<Token> left, Sense sense, ImmutableList<Token> right) {
			super(statement);
			this.left = left;
			this.sense = sense;
			this.right = right;
		}

		@Override
		public Kind kind() {
			return Kind.CONSTRAINT;
		}

		public ImmutableList<Token> left() {
			return left;
		}

		public Sense sense() {
			return sense;
		}

		public ImmutableList<Token> right() {
			return right;
		}
	}
}
