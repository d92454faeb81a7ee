package de.tu_berlin.coga.lpreader.model;

/**
 * Direction of the objective.
 */
public enum ObjectiveGoal {
	MIN("min"), MAX("max");

	private final String keyword;

	private ObjectiveGoal(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * Tells the keyword introducing an objective of this direction, without the
	 * trailing colon.
	 */
	public String keyword() {
		return keyword;
	}
}
