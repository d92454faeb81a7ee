package de.tu_berlin.coga.lpreader;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import de.tu_berlin.coga.lpreader.exceptions.InvalidNumberException;
import de.tu_berlin.coga.lpreader.exceptions.InvalidVariableNameException;
import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.UnexpectedTokenException;

public final class TokenizerTest {
	private static final Statement STATEMENT = new Statement(2, 5, "test");

	private static List<Token> tokenize(String text) throws LPFormatException {
		return Tokenizer.tokenize(STATEMENT, text);
	}

	@Test
	public void testTokenTypes() throws Exception {
		List<Token> tokens = tokenize("3x1 + -0.5 y_2 >= 4");
		assertThat(tokens).hasSize(8);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.NUMBER);
		assertThat(tokens.get(0).text()).isEqualTo("3");
		assertThat(tokens.get(1).type()).isEqualTo(TokenType.IDENTIFIER);
		assertThat(tokens.get(1).text()).isEqualTo("x1");
		assertThat(tokens.get(2).type()).isEqualTo(TokenType.SIGN);
		assertThat(tokens.get(2).isAttached()).isFalse();
		assertThat(tokens.get(3).type()).isEqualTo(TokenType.SIGN);
		assertThat(tokens.get(3).isAttached()).isTrue();
		assertThat(tokens.get(3).isNegative()).isTrue();
		assertThat(tokens.get(4).text()).isEqualTo("0.5");
		assertThat(tokens.get(5).text()).isEqualTo("y_2");
		assertThat(tokens.get(6).type()).isEqualTo(TokenType.RELATIONAL);
		assertThat(tokens.get(6).text()).isEqualTo(">=");
		assertThat(tokens.get(7).type()).isEqualTo(TokenType.NUMBER);
	}

	@Test
	public void testDoubleSign() throws Exception {
		List<Token> tokens = tokenize("--x1");
		assertThat(tokens).hasSize(3);
		assertThat(tokens.get(0).isAttached()).isFalse();
		assertThat(tokens.get(1).isAttached()).isTrue();
	}

	@Test
	public void testRelationalSpellings() throws Exception {
		assertThat(tokenize("<").get(0).text()).isEqualTo("<=");
		assertThat(tokenize("<=").get(0).text()).isEqualTo("<=");
		assertThat(tokenize("=<").get(0).text()).isEqualTo("<=");
		assertThat(tokenize(">").get(0).text()).isEqualTo(">=");
		assertThat(tokenize("=>").get(0).text()).isEqualTo(">=");
		assertThat(tokenize("=").get(0).text()).isEqualTo("=");
		assertThat(tokenize("x1 <= 2")).hasSize(3);
	}

	@Test
	public void testColonAndComma() throws Exception {
		List<Token> tokens = tokenize("a:b,c");
		assertThat(tokens.get(1).type()).isEqualTo(TokenType.COLON);
		assertThat(tokens.get(3).type()).isEqualTo(TokenType.COMMA);
	}

	@Test
	public void testInvalidNumbers() {
		for (String literal : new String[] { "3.", "1.2.3", ".5" }) {
			InvalidNumberException e = assertThrows(InvalidNumberException.class, () -> tokenize("x + " + literal));
			assertThat(e.getOffendingToken()).isEqualTo(literal);
			assertThat(e.getErrorOffset()).isEqualTo(5);
			assertThat(e.getStatementIndex()).isEqualTo(2);
		}
	}

	@Test
	public void testScientificNotation() {
		for (String literal : new String[] { "1e5", "2.5E-3", "3e+2" }) {
			InvalidNumberException e = assertThrows(InvalidNumberException.class, () -> tokenize("x <= " + literal));
			assertThat(e.getOffendingToken()).isEqualTo(literal);
		}
		assertThrows(InvalidNumberException.class, () -> tokenize("3e8x1 + x2"));
	}

	@Test
	public void testLetterEAfterNumberStartsAName() throws Exception {
		List<Token> tokens = tokenize("2 e8 + 3ex");
		assertThat(tokens.get(1).text()).isEqualTo("e8");
		assertThat(tokens.get(3).text()).isEqualTo("3");
		assertThat(tokens.get(4).text()).isEqualTo("ex");
	}

	@Test
	public void testInvalidIdentifier() {
		InvalidVariableNameException e = assertThrows(InvalidVariableNameException.class, () -> tokenize("2 _x"));
		assertThat(e.getOffendingToken()).isEqualTo("_x");
	}

	@Test
	public void testUnexpectedCharacter() {
		UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> tokenize("x1 * 2"));
		assertThat(e.getOffendingToken()).isEqualTo("*");
		assertThrows(UnexpectedTokenException.class, () -> tokenize("x|1"));
	}

	@Test
	public void testVariableNames() {
		assertThat(Tokenizer.isValidVariableName("x1")).isTrue();
		assertThat(Tokenizer.isValidVariableName("X1")).isTrue();
		assertThat(Tokenizer.isValidVariableName("x_1")).isTrue();
		assertThat(Tokenizer.isValidVariableName("x3_")).isTrue();
		assertThat(Tokenizer.isValidVariableName("1x")).isFalse();
		assertThat(Tokenizer.isValidVariableName("x-1")).isFalse();
		assertThat(Tokenizer.isValidVariableName("_x")).isFalse();
		assertThat(Tokenizer.isValidVariableName("")).isFalse();
	}
}
