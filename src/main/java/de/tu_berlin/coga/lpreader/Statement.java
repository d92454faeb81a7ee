package de.tu_berlin.coga.lpreader;

import com.google.common.base.Preconditions;

/**
 * One <code>;</code>-terminated statement of an <code>.lp</code> file with its
 * comments removed.
 */
public final class Statement {
	private final int index;
	private final int lineNo;
	private final String text;

	/**
	 * @param index
	 *          1-based position among the non-blank statements of the file
	 * @param lineNo
	 *          1-based line on which the statement starts
	 * @param text
	 *          the statement without terminator and surrounding whitespace
	 */
	public Statement(int index, int lineNo, String text) {
		Preconditions.checkArgument(index >= 1, "statement index must be positive");
		this.index = index;
		this.lineNo = lineNo;
		this.text = Preconditions.checkNotNull(text);
	}

	public int index() {
		return index;
	}

	public int lineNo() {
		return lineNo;
	}

	public String text() {
		return text;
	}

	@Override
	public String toString() {
		return "line " + lineNo + ": " + text + ";";
	}
}
