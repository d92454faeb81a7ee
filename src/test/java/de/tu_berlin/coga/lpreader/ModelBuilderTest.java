package de.tu_berlin.coga.lpreader;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import de.tu_berlin.coga.lpreader.exceptions.ConflictingDeclarationException;
import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.MissingObjectiveDirectionException;
import de.tu_berlin.coga.lpreader.model.Constraint;
import de.tu_berlin.coga.lpreader.model.LinearExpression;
import de.tu_berlin.coga.lpreader.model.Model;
import de.tu_berlin.coga.lpreader.model.Objective;
import de.tu_berlin.coga.lpreader.model.ObjectiveGoal;
import de.tu_berlin.coga.lpreader.model.Sense;
import de.tu_berlin.coga.lpreader.model.VariableDeclaration;
import de.tu_berlin.coga.lpreader.model.VariableKind;

public final class ModelBuilderTest {

	private static Model build(String... statements) throws LPFormatException {
		StatementClassifier classifier = new StatementClassifier();
		ModelBuilder builder = new ModelBuilder();
		for (int i = 0; i < statements.length; i++) {
			builder.add(classifier.classify(new Statement(i + 1, i + 1, statements[i])));
		}
		return builder.build();
	}

	@Test
	public void testBoundsOnlyProgram() throws Exception {
		Model model = build("max: x1 - x2", "x1 >= 0.3", "x1 <= 30.6", "x2 >= 24.9", "x2 <= 50.1");

		Model expected = new Model(
				new Objective(ObjectiveGoal.MAX, LinearExpression.builder().addTerm("x1", 1).addTerm("x2", -1).build()),
				ImmutableList.<Constraint> of(),
				ImmutableMap.of("x1", new VariableDeclaration("x1", 0.3, 30.6, VariableKind.CONTINUOUS), "x2",
						new VariableDeclaration("x2", 24.9, 50.1, VariableKind.CONTINUOUS)));
		assertThat(model).isEqualTo(expected);
	}

	@Test
	public void testLastBoundWins() throws Exception {
		Model model = build("max: x1", "x1 >= 0.3", "x1 <= 8", "x1 >= 5");
		assertThat(model.variable("x1").lowerBound()).isEqualTo(5.0);
		assertThat(model.variable("x1").upperBound()).isEqualTo(8.0);
	}

	@Test
	public void testBoundWithConstantOnTheLeft() throws Exception {
		Model model = build("max: x", "3 >= x", "-2 <= x");
		assertThat(model.variable("x").upperBound()).isEqualTo(3.0);
		assertThat(model.variable("x").lowerBound()).isEqualTo(-2.0);
		assertThat(model.constraints()).isEmpty();
	}

	@Test
	public void testEqualityFixesVariable() throws Exception {
		Model model = build("max: x1 + x2", "x1 = 30", "x2 <= 99.2");
		assertThat(model.variable("x1").lowerBound()).isEqualTo(30.0);
		assertThat(model.variable("x1").upperBound()).isEqualTo(30.0);
		assertThat(model.variable("x2").lowerBound()).isEqualTo(0.0);
	}

	@Test
	public void testLabelledBound() throws Exception {
		Model model = build("max: x1", "my_constraint: x1 <= 4");
		assertThat(model.constraints()).isEmpty();
		assertThat(model.variable("x1").upperBound()).isEqualTo(4.0);
	}

	@Test
	public void testRowsAreNormalized() throws Exception {
		Model model = build("min: x + y", "c1: 2x + 3 >= y - 1");
		assertThat(model.constraints()).hasSize(1);
		Constraint row = model.constraints().get(0);
		assertThat(row.expression().coefficients()).containsExactly("x", 2.0, "y", -1.0).inOrder();
		assertThat(row.sense()).isEqualTo(Sense.GEQ);
		assertThat(row.rhs()).isEqualTo(-4.0);
	}

	@Test
	public void testRowWithoutConstantsHasZeroRhs() throws Exception {
		Model model = build("max: x", "x + y <= 0");
		Constraint expected = new Constraint(LinearExpression.builder().addTerm("x", 1).addTerm("y", 1).build(),
				Sense.LEQ, 0);
		assertThat(model.constraints()).containsExactly(expected);
		assertThat(model.constraints().get(0).toString()).isEqualTo("x + y <= 0.0");
	}

	@Test
	public void testSingleVariableRowsThatAreNotBounds() throws Exception {
		Model model = build("max: x", "2x <= 4", "-x >= -3", "x + 5 >= 0", "x >= x");
		assertThat(model.constraints()).hasSize(4);
		assertThat(model.constraints().get(0).rhs()).isEqualTo(4.0);
		assertThat(model.constraints().get(1).expression().coefficient("x")).isEqualTo(-1.0);
		assertThat(model.constraints().get(2).rhs()).isEqualTo(-5.0);
		assertThat(model.constraints().get(3).expression().coefficient("x")).isEqualTo(0.0);
		assertThat(model.variable("x")).isEqualTo(VariableDeclaration.defaultFor("x"));
	}

	@Test
	public void testDeclarations() throws Exception {
		Model model = build("max: i + b + f + c", "i <= 7", "int i", "bin b", "free f");
		assertThat(model.variable("i")).isEqualTo(new VariableDeclaration("i", 0, 7, VariableKind.INTEGER));
		assertThat(model.variable("b")).isEqualTo(new VariableDeclaration("b", 0, 1, VariableKind.BINARY));
		assertThat(model.variable("f")).isEqualTo(
				new VariableDeclaration("f", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, VariableKind.FREE));
		assertThat(model.variable("c")).isEqualTo(VariableDeclaration.defaultFor("c"));
	}

	@Test
	public void testBoundAfterDeclaration() throws Exception {
		Model model = build("max: x", "free x", "x >= -3");
		assertThat(model.variable("x")).isEqualTo(
				new VariableDeclaration("x", -3, Double.POSITIVE_INFINITY, VariableKind.FREE));
	}

	@Test
	public void testRepeatedDeclarationOfSameKind() throws Exception {
		Model model = build("max: x", "int x", "x <= 4", "int x");
		assertThat(model.variable("x")).isEqualTo(new VariableDeclaration("x", 0, 4, VariableKind.INTEGER));
	}

	@Test
	public void testConflictingDeclaration() {
		ConflictingDeclarationException e = assertThrows(ConflictingDeclarationException.class,
				() -> build("max: x1", "int x1", "bin x1"));
		assertThat(e.getStatementIndex()).isEqualTo(3);
		assertThat(e.getOffendingToken()).isEqualTo("x1");
		assertThrows(ConflictingDeclarationException.class, () -> build("max: x1", "free x1", "int x1, x2"));
	}

	@Test
	public void testVariablesInOrderOfFirstAppearance() throws Exception {
		Model model = build("max: b", "c: a + b <= 3", "int c2", "7 >= d");
		assertThat(model.variableNames()).containsExactly("b", "a", "c2", "d").inOrder();
	}

	@Test
	public void testObjectiveOffsetAndEmptyObjective() throws Exception {
		assertThat(build("max: x1 + 80").objective().expression().constant()).isEqualTo(80.0);

		Model model = build("min:", "x + y >= 2");
		assertThat(model.objective().expression().isConstant()).isTrue();
		assertThat(model.variableNames()).containsExactly("x", "y").inOrder();
	}

	@Test
	public void testNoStatements() {
		assertThrows(MissingObjectiveDirectionException.class, () -> build());
	}
}
