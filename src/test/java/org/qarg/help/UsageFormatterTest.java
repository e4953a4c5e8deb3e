package org.qarg.help;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qarg.ArgParser;
import org.qarg.ArgParsing;
import org.qarg.ParserBuilder;
import org.qarg.Parsed;
import org.qarg.value.ValueTypes;

/** Tests the rendering of usage synopses and help text */
public class UsageFormatterTest {
	static class Example {
		String input;
		List<String> output;
		boolean verbose;
		String dataset;
		int optimize;
		List<Long> ids;
		Get get;
		ListCmd list;
	}

	static class Get {
		String item;
		int count;
	}

	static class ListCmd {
		String format;
		int limit;
	}

	private static ArgParser<Example> exampleParser() {
		return ArgParsing.<Example> build("example")//
			.positional("input", ValueTypes.STRING, (a, v) -> a.input = v, null)//
			.positionalList("output", ValueTypes.STRING, (a, v) -> a.output = v, null)//
			.flag("verbose", (a, v) -> a.verbose = v, o -> o.withShort('v').withHelp("verbosity level"))//
			.option("dataset", ValueTypes.STRING, (a, v) -> a.dataset = v, o -> o.withHelp("dataset to use"))//
			.option("optimize", ValueTypes.INT, (a, v) -> a.optimize = v, o -> o.withShort('O').withHelp("optimization level"))//
			.build();
	}

	private static ParserBuilder<Example> commandParser() {
		return ArgParsing.<Example> build("example")//
			.flag("verbose", (a, v) -> a.verbose = v, null)//
			.subcommand("get", Get::new, (a, g) -> a.get = g, cmd -> cmd.withHelp("fetch an item and print it")//
				.positional("item", ValueTypes.STRING, (g, v) -> g.item = v, o -> o.withHelp("item to fetch")))//
			.subcommand("list", ListCmd::new, (a, l) -> a.list = l, cmd -> cmd.withHelp("list available items")//
				.option("format", ValueTypes.STRING, (l, v) -> l.format = v, o -> o.withHelp("output format"))//
				.option("limit", ValueTypes.INT, (l, v) -> l.limit = v, null));
	}

	/** Tests the help text of a level with positional arguments and options */
	@Test
	public void testHelpText() {
		Assert.assertEquals(//
			"Usage: example [--verbose] [--dataset DATASET] [--optimize OPTIMIZE] INPUT [OUTPUT [OUTPUT ...]]\n"//
				+ "\n"//
				+ "Positional arguments:\n"//
				+ "  INPUT\n"//
				+ "  OUTPUT\n"//
				+ "\n"//
				+ "Options:\n"//
				+ "  --verbose, -v          verbosity level\n"//
				+ "  --dataset DATASET      dataset to use\n"//
				+ "  --optimize OPTIMIZE, -O OPTIMIZE\n"//
				+ "                         optimization level\n"//
				+ "  --help, -h             display this help and exit\n", //
			exampleParser().getHelp());
	}

	/** Tests the help text of a level with commands, and of a command */
	@Test
	public void testCommandHelp() {
		ArgParser<Example> parser = commandParser().build();
		Assert.assertEquals(//
			"Usage: example [--verbose]\n"//
				+ "\n"//
				+ "Options:\n"//
				+ "  --verbose\n"//
				+ "  --help, -h             display this help and exit\n"//
				+ "\n"//
				+ "Commands:\n"//
				+ "  get                    fetch an item and print it\n"//
				+ "  list                   list available items\n", //
			parser.getHelp());

		Parsed<Example> parsed = parser.parse(new Example(), "get", "--help");
		Assert.assertTrue(parsed.isHelpRequested());
		Assert.assertEquals(//
			"Usage: example get ITEM\n"//
				+ "\n"//
				+ "Positional arguments:\n"//
				+ "  ITEM                   item to fetch\n"//
				+ "\n"//
				+ "Options:\n"//
				+ "  --help, -h             display this help and exit\n", //
			parser.getHelp(parsed.getCommandChain()));
	}

	/** Tests the description, the epilogue, the version flag and the default and environment annotations */
	@Test
	public void testAnnotations() {
		ArgParser<Example> parser = ArgParsing.<Example> build("example")//
			.withDescription("this program does this and that")//
			.withEpilogue("For more information visit example.org/docs")//
			.withVersion("example 1.0.0")//
			.withEnvPrefix("EX_")//
			.option("dataset", ValueTypes.STRING, (a, v) -> a.dataset = v, o -> o.required().withHelp("dataset to use"))//
			.option("optimize", ValueTypes.INT, (a, v) -> a.optimize = v, o -> o.withDefault(2).fromEnv())//
			.listOption("ids", ValueTypes.LONG, (a, v) -> a.ids = v, o -> o.withHelp("ids to fetch").withDefault(Arrays.asList(1L, 2L)))//
			.build();
		Assert.assertEquals(//
			"this program does this and that\n"//
				+ "Usage: example --dataset DATASET [--optimize OPTIMIZE] [--ids IDS [IDS ...]]\n"//
				+ "\n"//
				+ "Options:\n"//
				+ "  --dataset DATASET      dataset to use\n"//
				+ "  --optimize OPTIMIZE    [default: 2] [env: EX_OPTIMIZE]\n"//
				+ "  --ids IDS              ids to fetch [default: 1 2]\n"//
				+ "  --help, -h             display this help and exit\n"//
				+ "  --version              display version and exit\n"//
				+ "\n"//
				+ "For more information visit example.org/docs\n", //
			parser.getHelp());
	}

	/** Tests a help column fitted to the longest entry */
	@Test
	public void testFittedColumn() {
		ArgParser<Example> parser = commandParser().withHelpColumn(20).fitHelpColumn().build();
		Assert.assertEquals(//
			"Usage: example [--verbose]\n"//
				+ "\n"//
				+ "Options:\n"//
				+ "  --verbose\n"//
				+ "  --help, -h  display this help and exit\n"//
				+ "\n"//
				+ "Commands:\n"//
				+ "  get         fetch an item and print it\n"//
				+ "  list        list available items\n", //
			parser.getHelp());
	}

	/** Tests the synopses of separate and required multi-value arguments and of optional positionals */
	@Test
	public void testSynopsis() {
		ArgParser<Example> parser = ArgParsing.<Example> build("prog")//
			.listOption("ids", ValueTypes.LONG, (a, v) -> a.ids = v, o -> o.separate().withShort('i'))//
			.positional("input", ValueTypes.STRING, (a, v) -> a.input = v, o -> o.withDefault("-"))//
			.positionalList("output", ValueTypes.STRING, (a, v) -> a.output = v, o -> o.required().withPlaceholder("FILE"))//
			.build();
		Assert.assertEquals("Usage: prog [--ids IDS] [INPUT] FILE [FILE ...]", parser.getUsage());
		Assert.assertEquals("prog", UsageFormatter.programName(Arrays.asList(parser.getShape())));
	}
}
