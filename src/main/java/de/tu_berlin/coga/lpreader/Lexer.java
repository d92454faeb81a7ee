package de.tu_berlin.coga.lpreader;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.exceptions.MalformedCommentException;
import de.tu_berlin.coga.lpreader.exceptions.MissingTerminatorException;

/**
 * Cuts the text of an <code>.lp</code> file into {@link Statement}s.
 * 
 * Comments are removed line by line before the text is split on
 * <code>;</code>: <code>//</code> runs to the end of the physical line,
 * <code>/* ... *&#47;</code> has to be closed on the line it opens on. A
 * statement may span several lines. Blank statements are skipped.
 * 
 * The lexer makes a single forward pass; call {@link #nextStatement()} until
 * it returns <code>null</code>.
 */
public class Lexer {
	private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

	private final Iterator<String> lines;
	private final Deque<Statement> ready = new ArrayDeque<Statement>();
	private final StringBuilder pending = new StringBuilder();
	private int pendingLineNo;
	private int lineNo;
	private int statementNo;
	private boolean exhausted;

	public Lexer(String input) {
		Preconditions.checkNotNull(input);
		lines = Splitter.onPattern("\r\n|\r|\n").split(input).iterator();
	}

	/**
	 * Tells the next statement.
	 * 
	 * @return the statement or <code>null</code> at the end of the input
	 */
	public Statement nextStatement() throws LPFormatException {
		while (ready.isEmpty() && !exhausted) {
			if (lines.hasNext()) {
				++lineNo;
				scanLine(lines.next());
			} else {
				exhausted = true;
				String rest = pending.toString().trim();
				if (!rest.isEmpty())
					throw new MissingTerminatorException("statement is not terminated by ';'",
							new Statement(statementNo + 1, pendingLineNo, rest), null);
			}
		}
		return ready.poll();
	}

	private void scanLine(String line) throws LPFormatException {
		String code = stripComments(line);
		for (int i = 0; i < code.length(); ++i) {
			char c = code.charAt(i);
			if (c == ';') {
				String text = pending.toString().trim();
				pending.setLength(0);
				if (!text.isEmpty()) {
					Statement statement = new Statement(++statementNo, pendingLineNo, text);
					LOGGER.debug("statement {}", statement);
					ready.add(statement);
				}
			} else {
				if (!CharMatcher.whitespace().matches(c) && CharMatcher.whitespace().matchesAllOf(pending))
					pendingLineNo = lineNo;
				pending.append(c);
			}
		}
		pending.append('\n');
	}

	private String stripComments(String line) throws MalformedCommentException {
		StringBuilder code = new StringBuilder(line.length());
		int i = 0;
		while (i < line.length()) {
			if (line.startsWith("//", i)) {
				break;
			} else if (line.startsWith("/*", i)) {
				int end = line.indexOf("*/", i + 2);
				if (end < 0)
					throw new MalformedCommentException("comment is not closed on the same line",
							new Statement(statementNo + 1, lineNo, line.trim()), "/*");
				code.append(' ');
				i = end + 2;
			} else if (line.startsWith("*/", i)) {
				throw new MalformedCommentException("comment end without start", new Statement(statementNo + 1, lineNo,
						line.trim()), "*/");
			} else {
				code.append(line.charAt(i));
				++i;
			}
		}
		return code.toString();
	}
}
