package de.tu_berlin.coga.lpreader;

/**
 * Lexical classes of the tokens inside a statement. Keywords are scanned as
 * identifiers and recognised by position.
 */
public enum TokenType {
	SIGN, NUMBER, IDENTIFIER, RELATIONAL, COLON, COMMA
}
