package de.tu_berlin.coga.lpreader;

/**
 * Signs read so far in front of one term. A term may carry at most one
 * detached sign followed by at most one attached sign.
 */
enum SignState {
	NO_SIGN, ONE_DETACHED, ONE_ATTACHED, ONE_OF_EACH;

	/**
	 * Tells the state after reading another sign.
	 * 
	 * @return the next state or <code>null</code> if the sign is one too many
	 */
	SignState next(boolean attached) {
		switch (this) {
		case NO_SIGN:
			return attached ? ONE_ATTACHED : ONE_DETACHED;
		case ONE_DETACHED:
			return attached ? ONE_OF_EACH : null;
		default:
			return null;
		}
	}
}
