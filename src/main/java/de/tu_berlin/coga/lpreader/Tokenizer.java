package de.tu_berlin.coga.lpreader;

import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

import de.tu_berlin.coga.lpreader.exceptions.InvalidNumberException;
import de.tu_berlin.coga.lpreader.exceptions.InvalidVariableNameException;
import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.UnexpectedTokenException;

/**
 * Splits the text of a statement into {@link Token}s.
 * 
 * Numbers are maximal runs of digits and dots, identifiers maximal runs of
 * letters, digits and underscores starting with a letter or underscore. A
 * number ends where a letter starts, so <code>3x1</code> scans as
 * <code>3</code> followed by <code>x1</code>. A number directly followed by an
 * exponent such as <code>e5</code> or <code>E-3</code> is rejected. Both are
 * validated against the patterns below once scanned.
 */
public final class Tokenizer {
	static final Pattern NUMBER_PATTERN = Pattern.compile("[0-9]+(\\.[0-9]+)?");
	static final Pattern VARNAME_PATTERN = Pattern.compile("[A-Za-z]+[A-Za-z0-9_]*");

	private Tokenizer() {
	}

	/**
	 * Tells whether a string is an acceptable variable name. Names are case
	 * sensitive.
	 */
	public static boolean isValidVariableName(String name) {
		return VARNAME_PATTERN.matcher(name).matches();
	}

	/**
	 * Scans a piece of statement text.
	 * 
	 * @param statement
	 *          the statement the text belongs to, for error reporting
	 * @param text
	 *          the text to scan
	 */
	public static ImmutableList<Token> tokenize(Statement statement, String text) throws LPFormatException {
		ImmutableList.Builder<Token> tokens = ImmutableList.builder();
		int n = text.length();
		int i = 0;
		while (i < n) {
			char c = text.charAt(i);
			if (Character.isWhitespace(c)) {
				++i;
			} else if (c == '+' || c == '-') {
				boolean attached = (i + 1 < n) && isOperandStart(text.charAt(i + 1));
				tokens.add(new Token(TokenType.SIGN, String.valueOf(c), i, attached));
				++i;
			} else if (isDigit(c) || c == '.') {
				int j = i;
				while (j < n && (isDigit(text.charAt(j)) || text.charAt(j) == '.'))
					++j;
				int exponentEnd = exponentEnd(text, j);
				if (exponentEnd > j) {
					String literal = text.substring(i, exponentEnd);
					throw new InvalidNumberException("scientific notation is not supported in '" + literal + "'",
							statement, literal);
				}
				String literal = text.substring(i, j);
				if (!NUMBER_PATTERN.matcher(literal).matches())
					throw new InvalidNumberException("'" + literal + "' is not a valid number", statement, literal);
				tokens.add(new Token(TokenType.NUMBER, literal, i, false));
				i = j;
			} else if (isLetter(c) || c == '_') {
				int j = i;
				while (j < n && isNameChar(text.charAt(j)))
					++j;
				String name = text.substring(i, j);
				if (!isValidVariableName(name))
					throw new InvalidVariableNameException("'" + name + "' is not a valid variable name", statement, name);
				tokens.add(new Token(TokenType.IDENTIFIER, name, i, false));
				i = j;
			} else if (c == '<' || c == '>') {
				String op = (c == '<') ? "<=" : ">=";
				tokens.add(new Token(TokenType.RELATIONAL, op, i, false));
				i += (i + 1 < n && text.charAt(i + 1) == '=') ? 2 : 1;
			} else if (c == '=') {
				// =< and => are spellings of <= and >=
				String op = "=";
				int length = 1;
				if (i + 1 < n && text.charAt(i + 1) == '<') {
					op = "<=";
					length = 2;
				} else if (i + 1 < n && text.charAt(i + 1) == '>') {
					op = ">=";
					length = 2;
				}
				tokens.add(new Token(TokenType.RELATIONAL, op, i, false));
				i += length;
			} else if (c == ':') {
				tokens.add(new Token(TokenType.COLON, ":", i, false));
				++i;
			} else if (c == ',') {
				tokens.add(new Token(TokenType.COMMA, ",", i, false));
				++i;
			} else {
				throw new UnexpectedTokenException("unexpected character", statement, String.valueOf(c));
			}
		}
		return tokens.build();
	}

	/**
	 * Tells where an exponent like <code>e5</code>, <code>E-3</code> or
	 * <code>e+2</code> starting at <code>start</code> ends.
	 * 
	 * @return the end of the exponent or <code>start</code> if there is none
	 */
	private static int exponentEnd(String text, int start) {
		int n = text.length();
		if (start >= n || (text.charAt(start) != 'e' && text.charAt(start) != 'E'))
			return start;
		int j = start + 1;
		if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-'))
			++j;
		if (j >= n || !isDigit(text.charAt(j)))
			return start;
		while (j < n && isDigit(text.charAt(j)))
			++j;
		return j;
	}

	private static boolean isOperandStart(char c) {
		return isDigit(c) || c == '.' || isLetter(c) || c == '_';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isNameChar(char c) {
		return isLetter(c) || isDigit(c) || c == '_';
	}
}
