package de.tu_berlin.coga.lpreader;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;

import de.tu_berlin.coga.lpreader.exceptions.LPFormatException;
import de.tu_berlin.coga.lpreader.model.Model;

/**
 * A class to read linear programs from <code>.lp</code> files.
 * 
 * Initialise with the file name and invoke the method <code>readLP()</code> to
 * parse a {@link Model} from an <code>.lp</code> file. The format is a subset
 * of the LPSolve syntax:
 * 
 * <pre>
 * max: 3x + 2y - 4.5;       // objective, always the first statement
 * c1: x + y &lt;= 10;          // constraint, the label is ignored
 * x &lt;= 4;                   // bound on a single variable
 * int y;                    // declarations: int, bin, free
 * </pre>
 * 
 * Reading is all or nothing: the first malformed statement aborts with a
 * subclass of {@link LPFormatException}.
 */
public class LPReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(LPReader.class);

	private final String filename;
	private final Charset charset;

	/**
	 * Initialises the reader for a UTF-8 encoded file.
	 * 
	 * @param fname
	 *          file name to read from
	 */
	public LPReader(String fname) {
		this(fname, StandardCharsets.UTF_8);
	}

	/**
	 * Initialises the reader.
	 * 
	 * @param fname
	 *          file name to read from
	 * @param charset
	 *          encoding of the file
	 */
	public LPReader(String fname, Charset charset) {
		this.filename = Preconditions.checkNotNull(fname);
		this.charset = Preconditions.checkNotNull(charset);
	}

	/**
	 * Reads the linear program from the file with which the reader was
	 * initialised.
	 */
	public Model readLP() throws LPFormatException, IOException {
		String text = Files.asCharSource(new File(filename), charset).read();
		Model model = parse(text);
		LOGGER.info("read '{}': {} variables, {} constraints", filename, model.noOfVariables(),
				model.noOfConstraints());
		return model;
	}

	/**
	 * Reads a linear program from a character stream. The stream is consumed
	 * but not closed.
	 */
	public static Model parse(Reader in) throws LPFormatException, IOException {
		return parse(CharStreams.toString(in));
	}

	/**
	 * Reads a linear program from its text.
	 */
	public static Model parse(String text) throws LPFormatException {
		Lexer lexer = new Lexer(text);
		StatementClassifier classifier = new StatementClassifier();
		ModelBuilder builder = new ModelBuilder();
		Statement statement;
		while ((statement = lexer.nextStatement()) != null) {
			builder.add(classifier.classify(statement));
		}
		return builder.build();
	}
}
