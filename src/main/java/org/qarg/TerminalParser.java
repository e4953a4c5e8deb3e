package org.qarg;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;

import org.apache.log4j.Logger;
import org.qarg.error.ArgumentParseException;

/**
 * Runs an {@link ArgParser} the way a program's main method would: help and version requests are printed to the output stream and end
 * the program successfully, and parse failures are reported to the error stream and end the program with
 * {@link ParserSettings#USAGE_ERROR_STATUS}. The streams, the environment and the way the program ends are all supplied by the caller.
 *
 * @param <C> The type of the destination object
 */
public class TerminalParser<C> {
	private static final Logger log = Logger.getLogger(TerminalParser.class);

	private final ArgParser<C> theParser;
	private final Map<String, String> theEnvironment;
	private final PrintStream theOut;
	private final PrintStream theErr;
	private final IntConsumer theExit;

	/**
	 * @param parser The parser to run
	 * @param environment The environment variables to consult
	 * @param out The stream to print help and version text to
	 * @param err The stream to print parse failures to
	 * @param exit Ends the program with a status
	 */
	public TerminalParser(ArgParser<C> parser, Map<String, String> environment, PrintStream out, PrintStream err, IntConsumer exit) {
		theParser = parser;
		theEnvironment = environment;
		theOut = out;
		theErr = err;
		theExit = exit;
	}

	/**
	 * @param <C> The type of the destination object
	 * @param parser The parser to run
	 * @return A terminal parser using the process's environment and standard streams, calling {@link System#exit(int)}
	 */
	public static <C> TerminalParser<C> system(ArgParser<C> parser) {
		return new TerminalParser<>(parser, System.getenv(), System.out, System.err, System::exit);
	}

	/**
	 * @param target The destination to bind the top-level fields into
	 * @param args The command-line arguments, excluding the program name
	 * @return The parse result, or null if the parse failed and the exit callback returned
	 */
	public Parsed<C> mustParse(C target, String... args) {
		return mustParse(target, Arrays.asList(args));
	}

	/**
	 * @param target The destination to bind the top-level fields into
	 * @param args The command-line arguments, excluding the program name
	 * @return The parse result, or null if the parse failed and the exit callback returned
	 */
	public Parsed<C> mustParse(C target, List<String> args) {
		Parsed<C> parsed;
		try {
			parsed = theParser.parse(target, args, theEnvironment);
		} catch (ArgumentParseException e) {
			if (log.isDebugEnabled())
				log.debug("Could not parse " + args, e);
			theParser.report(e, theErr);
			theExit.accept(ParserSettings.USAGE_ERROR_STATUS);
			return null;
		}
		if (parsed.isHelpRequested()) {
			theOut.print(theParser.getHelp(parsed.getCommandChain()));
			theOut.flush();
			theExit.accept(0);
		} else if (parsed.isVersionRequested()) {
			theOut.print(theParser.getSettings().getVersion() + "\n");
			theOut.flush();
			theExit.accept(0);
		}
		return parsed;
	}
}
