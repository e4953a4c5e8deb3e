package org.qarg;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qarg.parse.ValueSource;
import org.qarg.shape.CommandShape;
import org.qarg.shape.FieldDescriptor;
import org.qarg.shape.FieldKind;
import org.qarg.value.ValueTypes;

/** Tests parsing through the public entry points */
public class ArgParserTest {
	enum Mode {
		FAST, SAFE
	}

	static class Args {
		String foo;
		boolean bar;
		int count;
		Duration timeout;
		Mode mode;
		Connection connection = new Connection();
		Remote remote;
	}

	static class Connection {
		String host;
		int port;
	}

	static class Remote {
		boolean verbose;
		Add add;
	}

	static class Add {
		String name;
		String url;
	}

	private static ArgParser<Args> parser() {
		return ArgParsing.<Args> build("example")//
			.option("foo", ValueTypes.STRING, (a, v) -> a.foo = v, null)//
			.flag("bar", (a, v) -> a.bar = v, null)//
			.option("count", ValueTypes.INT, (a, v) -> a.count = v, o -> o.withShort('n'))//
			.option("timeout", ValueTypes.DURATION, (a, v) -> a.timeout = v, o -> o.withDefault(Duration.ofSeconds(30)))//
			.option("mode", ValueTypes.enumType(Mode.class), (a, v) -> a.mode = v, null)//
			.<Connection> include("connection", a -> a.connection, grp -> grp//
				.option("host", ValueTypes.STRING, (c, v) -> c.host = v, null)//
				.option("port", ValueTypes.INT, (c, v) -> c.port = v, o -> o.withDefault(8080)))//
			.subcommand("remote", Remote::new, (a, r) -> a.remote = r, cmd -> cmd//
				.withAliases("r")//
				.flag("verbose", (r, v) -> r.verbose = v, o -> o.withShort('v'))//
				.subcommand("add", Add::new, (r, add) -> r.add = add, sub -> sub//
					.positional("name", ValueTypes.STRING, (add, v) -> add.name = v, null)//
					.positional("url", ValueTypes.STRING, (add, v) -> add.url = v, null)))//
			.build();
	}

	/** Tests the basic usage of a parser */
	@Test
	public void testBasicUsage() {
		Args args = parser().parse(new Args(), "--foo=hello", "--bar").getConfig();
		Assert.assertEquals("hello", args.foo);
		Assert.assertTrue(args.bar);
		Assert.assertEquals(Duration.ofSeconds(30), args.timeout);
		Assert.assertNull(args.mode);

		args = parser().parse(new Args(), "--timeout", "1m", "--mode", "SAFE", "-n", "3").getConfig();
		Assert.assertEquals(Duration.ofMinutes(1), args.timeout);
		Assert.assertEquals(Mode.SAFE, args.mode);
		Assert.assertEquals(3, args.count);
	}

	/** Tests that values the caller pre-populates survive when nothing else binds the field */
	@Test
	public void testPrepopulatedValues() {
		Args args = new Args();
		args.foo = "default value";
		Assert.assertEquals("default value", parser().parse(args).getConfig().foo);
	}

	/** Tests options of an included group */
	@Test
	public void testIncludedGroup() {
		Parsed<Args> parsed = parser().parse(new Args(), "--host", "example.com");
		Assert.assertEquals("example.com", parsed.getConfig().connection.host);
		Assert.assertEquals(8080, parsed.getConfig().connection.port);
		Assert.assertEquals(ValueSource.COMMAND_LINE, parsed.getSource("connection", "host"));
		Assert.assertEquals(ValueSource.DEFAULT, parsed.getSource("connection", "port"));
	}

	/** Tests the selection of nested commands, by name or alias */
	@Test
	public void testNestedCommands() {
		Parsed<Args> parsed = parser().parse(new Args(), "r", "-v", "add", "origin", "https://example.com/repo.git", "--bar");
		Args args = parsed.getConfig();
		Assert.assertTrue(args.bar);
		Assert.assertTrue(args.remote.verbose);
		Assert.assertEquals("origin", args.remote.add.name);
		Assert.assertEquals("https://example.com/repo.git", args.remote.add.url);

		SelectedCommand command = parsed.getCommand();
		Assert.assertTrue(command.is("remote"));
		Assert.assertSame(args.remote, command.as(Remote.class));
		Assert.assertTrue(command.getNext().is("add"));
		Assert.assertSame(args.remote.add, command.getNext().getPayload());
		Assert.assertFalse(command.getNext().getNext().isPresent());
		Assert.assertEquals("remote add", command.toString());
		Assert.assertEquals(Arrays.asList("remote", "add"), parsed.getResolvedShape().getPath());
		Assert.assertEquals(ValueSource.COMMAND_LINE, parsed.getSource("remote", "add", "url"));

		try {
			SelectedCommand.none().getName();
			Assert.fail("Expected an IllegalStateException");
		} catch (IllegalStateException e) {
			// Expected
		}
		try {
			command.as(Add.class);
			Assert.fail("Expected a ClassCastException");
		} catch (ClassCastException e) {
			// Expected
		}
	}

	/** Tests that every option named in a usage synopsis binds its own field when passed back to the parser */
	@Test
	public void testSynopsisRoundTrip() {
		ArgParser<Args> parser = parser();
		CommandShape<Args> shape = parser.getShape();
		List<String> flags = new ArrayList<>();
		for (String word : parser.getUsage().split(" ")) {
			String stripped = word.replace("[", "").replace("]", "");
			if (stripped.startsWith("--"))
				flags.add(stripped);
		}
		Assert.assertEquals(shape.getOptions().size(), flags.size());
		for (String flag : flags) {
			FieldDescriptor<Args> field = shape.getOption(flag.substring(2));
			Assert.assertNotNull(flag, field);
			List<String> argv = new ArrayList<>();
			argv.add(flag);
			if (field.getKind() != FieldKind.FLAG)
				argv.add(sampleValue(field));
			Parsed<Args> parsed = parser.parse(new Args(), argv.toArray(new String[argv.size()]));
			Assert.assertEquals(flag, ValueSource.COMMAND_LINE, parsed.getSource(field.getPath().toArray(new String[0])));
		}
	}

	private static String sampleValue(FieldDescriptor<?> field) {
		switch (field.getValueType().getName()) {
		case "int":
			return "1";
		case "duration":
			return "5s";
		case "Mode":
			return "FAST";
		default:
			return "text";
		}
	}

	/** Tests the version flag */
	@Test
	public void testVersion() {
		ArgParser<Args> parser = ArgParsing.<Args> build("example")//
			.withVersion("example 1.0")//
			.option("foo", ValueTypes.STRING, (a, v) -> a.foo = v, o -> o.required())//
			.build();
		Parsed<Args> parsed = parser.parse(new Args(), "--version");
		Assert.assertTrue(parsed.isVersionRequested());
		Assert.assertFalse(parsed.isHelpRequested());
		Assert.assertEquals("example 1.0", parser.getSettings().getVersion());

		ArgParser<Args> noVersion = ArgParsing.<Args> build("example").build();
		try {
			noVersion.parse(new Args(), "--version");
			Assert.fail("Expected an unknown flag");
		} catch (IllegalArgumentException e) {
			Assert.assertEquals("unknown argument --version", e.getMessage());
		}
	}
}
