package de.tu_berlin.coga.lpreader;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.lpreader.ParsedStatement.ConstraintStatement;
import de.tu_berlin.coga.lpreader.ParsedStatement.DeclarationStatement;
import de.tu_berlin.coga.lpreader.ParsedStatement.ObjectiveStatement;
import de.tu_berlin.coga.lpreader.exceptions.DuplicateObjectiveException;
import de.tu_berlin.coga.lpreader.exceptions.InvalidConstraintShapeException;
import de.tu_berlin.coga.lpreader.exceptions.InvalidDeclarationException;
import de.tu_berlin.coga.lpreader.exceptions.InvalidVariableNameException;
import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.MissingObjectiveDirectionException;
import de.tu_berlin.coga.lpreader.model.ObjectiveGoal;
import de.tu_berlin.coga.lpreader.model.VariableKind;

/**
 * Decides from its leading tokens what a statement is.
 * 
 * <ul>
 * <li>The first statement has to start with <code>max:</code> or
 * <code>min:</code>; no later statement may.</li>
 * <li>A statement starting with the word <code>int</code>, <code>bin</code> or
 * <code>free</code> that contains neither a colon nor a relational operator is
 * a declaration. Its names are separated by commas, whitespace or both.</li>
 * <li>Anything else is a constraint with an optional <code>label:</code>
 * prefix.</li>
 * </ul>
 * 
 * Classification is purely syntactic. Whether a constraint only bounds a
 * single variable is decided by the {@link ModelBuilder}.
 */
public class StatementClassifier {
	private static final Logger LOGGER = LoggerFactory.getLogger(StatementClassifier.class);

	private static final CharMatcher DECLARATION_BLOCKERS = CharMatcher.anyOf(":<>=");
	private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults();
	private static final Splitter WHITESPACE_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

	public ParsedStatement classify(Statement statement) throws LPFormatException {
		String text = statement.text();
		ObjectiveGoal goal = objectiveGoal(text);
		if (statement.index() == 1) {
			if (goal == null)
				throw new MissingObjectiveDirectionException("objective must start with 'max:' or 'min:'", statement,
						null);
			LOGGER.debug("statement {} is the objective ({})", statement.index(), goal);
			return new ObjectiveStatement(statement, goal,
					Tokenizer.tokenize(statement, text.substring(goal.keyword().length() + 1)));
		}
		if (goal != null)
			throw new DuplicateObjectiveException("objective already defined", statement, goal.keyword() + ":");

		VariableKind declared = declarationKind(text);
		if (declared != null) {
			LOGGER.debug("statement {} is a declaration ({})", statement.index(), declared);
			return new DeclarationStatement(statement, declared, declaredNames(statement, text));
		}
		LOGGER.debug("statement {} is a constraint", statement.index());
		return constraint(statement, text);
	}

	private static ObjectiveGoal objectiveGoal(String text) {
		for (ObjectiveGoal goal : ObjectiveGoal.values()) {
			if (text.startsWith(goal.keyword() + ":"))
				return goal;
		}
		return null;
	}

	private static VariableKind declarationKind(String text) {
		if (DECLARATION_BLOCKERS.matchesAnyOf(text))
			return null;
		int end = CharMatcher.whitespace().indexIn(text);
		String keyword = (end < 0) ? text : text.substring(0, end);
		if (keyword.equals("int")) {
			return VariableKind.INTEGER;
		} else if (keyword.equals("bin")) {
			return VariableKind.BINARY;
		} else if (keyword.equals("free")) {
			return VariableKind.FREE;
		}
		return null;
	}

	private static ImmutableList<String> declaredNames(Statement statement, String text) throws LPFormatException {
		int start = CharMatcher.whitespace().indexIn(text);
		if (start < 0)
			throw new InvalidDeclarationException("declaration without variables", statement, text);
		String list = text.substring(start).trim();
		ImmutableList.Builder<String> names = ImmutableList.builder();
		for (String entry : COMMA_SPLITTER.split(list)) {
			if (entry.isEmpty())
				throw new InvalidDeclarationException("empty entry in declaration list", statement, ",");
			for (String name : WHITESPACE_SPLITTER.split(entry)) {
				if (!Tokenizer.isValidVariableName(name))
					throw new InvalidVariableNameException("'" + name + "' is not a valid variable name", statement, name);
				names.add(name);
			}
		}
		return names.build();
	}

	private static ConstraintStatement constraint(Statement statement, String text) throws LPFormatException {
		// the label is discarded unscanned
		int colon = text.indexOf(':');
		String body = (colon < 0) ? text : text.substring(colon + 1);
		List<Token> tokens = Tokenizer.tokenize(statement, body);

		int relational = -1;
		for (int i = 0; i < tokens.size(); ++i) {
			if (tokens.get(i).type() == TokenType.RELATIONAL) {
				if (relational >= 0)
					throw new InvalidConstraintShapeException("more than one relational operator", statement,
							tokens.get(i).text());
				relational = i;
			}
		}
		if (relational < 0)
			throw new InvalidConstraintShapeException("no relational operator", statement, null);
		Token op = tokens.get(relational);
		if (relational == 0 || relational == tokens.size() - 1)
			throw new InvalidConstraintShapeException("empty side of constraint", statement, op.text());

		boolean hasVariable = false;
		for (Token token : tokens) {
			hasVariable |= token.type() == TokenType.IDENTIFIER;
		}
		if (!hasVariable)
			throw new InvalidConstraintShapeException("constraint without variables", statement, null);

		return new ConstraintStatement(statement, ImmutableList.copyOf(tokens.subList(0, relational)), op.sense(),
				ImmutableList.copyOf(tokens.subList(relational + 1, tokens.size())));
	}
}
