package org.qarg.help;

import java.io.PrintStream;

import org.qarg.error.ArgumentParseException;

/** Renders parse failures for the user as the usage synopsis of the level resolved at failure, followed by the error message */
public class ErrorReporter {
	private final UsageFormatter theFormatter;

	/** @param formatter The formatter for the synopsis */
	public ErrorReporter(UsageFormatter formatter) {
		theFormatter = formatter;
	}

	/**
	 * @param error The parse failure
	 * @return The report, e.g. "Usage: example get [--count COUNT]\nerror: missing value for --count\n"
	 */
	public String report(ArgumentParseException error) {
		return theFormatter.synopsis(error.getCommandChain()) + "\nerror: " + error.getMessage() + "\n";
	}

	/**
	 * @param error The parse failure
	 * @param stream The stream to print the report to
	 */
	public void report(ArgumentParseException error, PrintStream stream) {
		stream.print(report(error));
		stream.flush();
	}
}
