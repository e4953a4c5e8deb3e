package org.qarg;

import java.util.Collections;

import org.qarg.shape.CommandShape;
import org.qarg.shape.FieldDescriptor;
import org.qarg.shape.ShapeBuilder;
import org.qarg.shape.ShapeException;
import org.qarg.shape.SubcommandDescriptor;

/**
 * Declares the top level of a program's arguments, along with the settings of the parser
 *
 * @param <C> The type of the destination object
 */
public class ParserBuilder<C> extends ShapeBuilder<C, ParserBuilder<C>> {
	private String theVersion;
	private int theHelpColumn;
	private boolean isHelpColumnFitted;
	private String theEnvPrefix;

	ParserBuilder(String programName) {
		super(checkName(programName), Collections.emptyList(), Collections.emptyList(), true);
		theHelpColumn = ParserSettings.DEFAULT_HELP_COLUMN;
	}

	private static String checkName(String programName) {
		if (programName == null)
			throw new NullPointerException("Program name must not be null");
		return programName;
	}

	/**
	 * Adds the implicit "--version" flag, which prints the version and ends the program like "--help"
	 *
	 * @param version The program version
	 * @return This builder
	 */
	public ParserBuilder<C> withVersion(String version) {
		theVersion = version;
		return this;
	}

	/**
	 * @param column The column at which help text is aligned (default 25). Entries too long for it have their help text on the next
	 *        line.
	 * @return This builder
	 */
	public ParserBuilder<C> withHelpColumn(int column) {
		if (column < 4)
			throw new IllegalArgumentException("Help column must be at least 4: " + column);
		theHelpColumn = column;
		return this;
	}

	/**
	 * Causes help text to be aligned just past the longest entry of each listing, so that the {@link #withHelpColumn(int) help column}
	 * becomes a maximum
	 *
	 * @return This builder
	 */
	public ParserBuilder<C> fitHelpColumn() {
		isHelpColumnFitted = true;
		return this;
	}

	/**
	 * @param prefix The prefix prepended to every declared environment variable name, e.g. "APP_"
	 * @return This builder
	 */
	public ParserBuilder<C> withEnvPrefix(String prefix) {
		theEnvPrefix = prefix;
		return this;
	}

	/**
	 * @return The parser for the declared arguments
	 * @throws ShapeException If the declared arguments are inconsistent
	 */
	public ArgParser<C> build() {
		CommandShape<C> shape = buildShape();
		if (theVersion != null)
			checkVersionFree(shape);
		return new ArgParser<>(shape, new ParserSettings(theVersion, theHelpColumn, isHelpColumnFitted, theEnvPrefix));
	}

	private static void checkVersionFree(CommandShape<?> shape) {
		for (FieldDescriptor<?> option : shape.getOptions()) {
			if (ParserSettings.VERSION_NAME.equals(option.getName()))
				throw new ShapeException("--" + ParserSettings.VERSION_NAME + " is reserved when a program version is configured");
		}
		for (SubcommandDescriptor<?, ?> sub : shape.getSubcommands())
			checkVersionFree(sub.getShape());
	}
}
