package org.qarg;

/**
 * <p>
 * Entry point for declaring command-line parsers. A parser is declared once for a destination type, then may parse any number of
 * command lines into fresh destinations:
 * </p>
 *
 * <pre>
 * ArgParser&lt;Args&gt; parser = ArgParsing.&lt;Args&gt; build("example")//
 * 	.flag("verbose", (a, v) -&gt; a.verbose = v, o -&gt; o.withShort('v').withHelp("verbosity level"))//
 * 	.option("dataset", ValueTypes.STRING, (a, v) -&gt; a.dataset = v, o -&gt; o.withHelp("dataset to use"))//
 * 	.positional("input", ValueTypes.STRING, (a, v) -&gt; a.input = v, null)//
 * 	.build();
 * Parsed&lt;Args&gt; parsed = parser.parse(new Args(), "--verbose", "in.txt");
 * </pre>
 */
public class ArgParsing {
	private ArgParsing() {}

	/**
	 * @param <C> The type of the destination object
	 * @param programName The name of the program, printed in usage
	 * @return A builder to declare the program's arguments with
	 */
	public static <C> ParserBuilder<C> build(String programName) {
		return new ParserBuilder<>(programName);
	}
}
