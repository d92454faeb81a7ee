package de.tu_berlin.coga.lpreader;

import java.util.List;

import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.TooManySignsException;
import de.tu_berlin.coga.lpreader.exceptions.UnexpectedTokenException;
import de.tu_berlin.coga.lpreader.model.LinearExpression;

/**
 * Turns the tokens of one side of a statement into a {@link LinearExpression}.
 * 
 * A term is <code>[sign] [sign] number [identifier]</code> or
 * <code>[sign] [sign] identifier</code>, where the first sign is detached and
 * the second attached (see {@link SignState}). A term without a sign is added.
 * A number followed by an identifier is its coefficient, a number on its own a
 * constant. Repeated variables are summed.
 */
public class TermParser {

	public LinearExpression parse(Statement statement, List<Token> tokens) throws LPFormatException {
		LinearExpression.Builder expression = LinearExpression.builder();
		int pos = 0;
		while (pos < tokens.size()) {
			SignState signs = SignState.NO_SIGN;
			double sign = 1;
			Token token = tokens.get(pos);
			while (token.type() == TokenType.SIGN) {
				signs = signs.next(token.isAttached());
				if (signs == null)
					throw new TooManySignsException("too many signs in front of a term", statement, token.text());
				if (token.isNegative())
					sign = -sign;
				if (++pos == tokens.size())
					throw new UnexpectedTokenException("sign without term", statement, token.text());
				token = tokens.get(pos);
			}

			if (token.type() == TokenType.NUMBER) {
				double value = sign * Double.parseDouble(token.text());
				++pos;
				if (pos < tokens.size() && tokens.get(pos).type() == TokenType.IDENTIFIER) {
					expression.addTerm(tokens.get(pos).text(), value);
					++pos;
				} else {
					expression.addConstant(value);
				}
			} else if (token.type() == TokenType.IDENTIFIER) {
				expression.addTerm(token.text(), sign);
				++pos;
			} else {
				throw new UnexpectedTokenException("expected a number or variable", statement, token.text());
			}
		}
		return expression.build();
	}
}
