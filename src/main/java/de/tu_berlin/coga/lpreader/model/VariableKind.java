package de.tu_berlin.coga.lpreader.model;

/**
 * Kind of a decision variable. Variables never mentioned in a declaration are
 * {@link #CONTINUOUS}.
 */
public enum VariableKind {
	CONTINUOUS, INTEGER, BINARY, FREE
}
