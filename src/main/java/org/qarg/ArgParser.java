package org.qarg;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.qarg.error.ArgumentParseException;
import org.qarg.help.ErrorReporter;
import org.qarg.help.UsageFormatter;
import org.qarg.parse.ArgumentMatcher;
import org.qarg.parse.ParseState;
import org.qarg.parse.PrecedenceResolver;
import org.qarg.shape.CommandShape;

/**
 * Parses command lines into destinations of a declared shape. A parser is immutable and may be used for any number of parses, from any
 * number of threads, as long as each parse has its own destination.
 *
 * @param <C> The type of the destination object
 */
public class ArgParser<C> {
	private final CommandShape<C> theShape;
	private final ParserSettings theSettings;
	private final ArgumentMatcher theMatcher;
	private final UsageFormatter theFormatter;
	private final ErrorReporter theReporter;

	ArgParser(CommandShape<C> shape, ParserSettings settings) {
		theShape = shape;
		theSettings = settings;
		theMatcher = new ArgumentMatcher();
		theFormatter = new UsageFormatter(settings);
		theReporter = new ErrorReporter(theFormatter);
	}

	/** @return The shape of the top level */
	public CommandShape<C> getShape() {
		return theShape;
	}

	/** @return This parser's settings */
	public ParserSettings getSettings() {
		return theSettings;
	}

	/**
	 * Parses a command line with an empty environment
	 *
	 * @param target The destination to bind the top-level fields into
	 * @param args The command-line arguments, excluding the program name
	 * @return The parse result
	 * @throws ArgumentParseException If the arguments cannot be bound
	 */
	public Parsed<C> parse(C target, String... args) throws ArgumentParseException {
		return parse(target, Arrays.asList(args), Collections.emptyMap());
	}

	/**
	 * <p>
	 * Parses a command line. Arguments are bound as they are encountered; then fields the command line left unset are bound from the
	 * environment, and every required field of the resolved commands is checked.
	 * </p>
	 * <p>
	 * If the command line asks for help or the version, parsing stops there without error and without consulting the environment. See
	 * {@link Parsed#isHelpRequested()}.
	 * </p>
	 *
	 * @param target The destination to bind the top-level fields into
	 * @param args The command-line arguments, excluding the program name
	 * @param environment The environment variables to consult for fields not given on the command line
	 * @return The parse result
	 * @throws ArgumentParseException If the arguments cannot be bound
	 */
	public Parsed<C> parse(C target, List<String> args, Map<String, String> environment) throws ArgumentParseException {
		if (target == null)
			throw new NullPointerException("Target must not be null");
		ParseState state = new ParseState(theShape, target, theSettings.getVersionName());
		theMatcher.match(state, args);
		if (!state.isHelpRequested() && !state.isVersionRequested()) {
			PrecedenceResolver resolver = new PrecedenceResolver(environment, theSettings);
			resolver.resolve(state);
			resolver.checkRequired(state);
		}
		return new Parsed<>(target, state);
	}

	/** @return The one-line usage synopsis of the top level */
	public String getUsage() {
		return theFormatter.synopsis(Collections.singletonList(theShape));
	}

	/** @return The help text of the top level */
	public String getHelp() {
		return getHelp(Collections.singletonList(theShape));
	}

	/**
	 * @param chain The resolved command levels, e.g. from {@link Parsed#getCommandChain()}
	 * @return The help text of the deepest level
	 */
	public String getHelp(List<? extends CommandShape<?>> chain) {
		return theFormatter.help(chain);
	}

	/**
	 * @param error The parse failure
	 * @return The usage synopsis of the level resolved at failure, followed by the error message
	 */
	public String report(ArgumentParseException error) {
		return theReporter.report(error);
	}

	/**
	 * @param error The parse failure
	 * @param stream The stream to print the report to
	 */
	public void report(ArgumentParseException error, PrintStream stream) {
		theReporter.report(error, stream);
	}

	@Override
	public String toString() {
		return getUsage();
	}
}
