package org.qarg;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.qarg.value.ValueTypes;

/** Tests the program-level handling of help, version and failures */
public class TerminalParserTest {
	static class Args {
		String input;
		boolean verbose;
	}

	static class Timed {
		Duration timeout;
	}

	private ByteArrayOutputStream theOut;
	private ByteArrayOutputStream theErr;
	private List<Integer> theExits;
	private TerminalParser<Args> theParser;

	/** Creates the parser with captured streams */
	@Before
	public void setup() throws UnsupportedEncodingException {
		theOut = new ByteArrayOutputStream();
		theErr = new ByteArrayOutputStream();
		theExits = new ArrayList<>();
		ArgParser<Args> parser = ArgParsing.<Args> build("example")//
			.withVersion("example 2.1")//
			.positional("input", ValueTypes.STRING, (a, v) -> a.input = v, null)//
			.flag("verbose", (a, v) -> a.verbose = v, o -> o.withShort('v'))//
			.build();
		theParser = new TerminalParser<>(parser, Collections.emptyMap(), new PrintStream(theOut, true, "UTF-8"),
			new PrintStream(theErr, true, "UTF-8"), theExits::add);
	}

	private String out() throws UnsupportedEncodingException {
		return theOut.toString("UTF-8");
	}

	private String err() throws UnsupportedEncodingException {
		return theErr.toString("UTF-8");
	}

	/** Tests a successful parse */
	@Test
	public void testSuccess() throws UnsupportedEncodingException {
		Parsed<Args> parsed = theParser.mustParse(new Args(), "-v", "in");
		Assert.assertEquals("in", parsed.getConfig().input);
		Assert.assertTrue(parsed.getConfig().verbose);
		Assert.assertTrue(theExits.isEmpty());
		Assert.assertEquals("", out());
		Assert.assertEquals("", err());
	}

	/** Tests that a failure is reported to the error stream with a usage-error status */
	@Test
	public void testFailure() throws UnsupportedEncodingException {
		Assert.assertNull(theParser.mustParse(new Args(), "in", "--nope"));
		Assert.assertEquals(Collections.singletonList(ParserSettings.USAGE_ERROR_STATUS), theExits);
		Assert.assertEquals("Usage: example [--verbose] INPUT\nerror: unknown argument --nope\n", err());
		Assert.assertEquals("", out());
	}

	/** Tests that a value too large for its type is reported like any other conversion failure */
	@Test
	public void testConversionFailure() throws UnsupportedEncodingException {
		TerminalParser<Timed> parser = new TerminalParser<>(ArgParsing.<Timed> build("timed")//
			.option("timeout", ValueTypes.DURATION, (a, v) -> a.timeout = v, null)//
			.build(), Collections.emptyMap(), new PrintStream(theOut, true, "UTF-8"), new PrintStream(theErr, true, "UTF-8"), theExits::add);
		Assert.assertNull(parser.mustParse(new Timed(), "--timeout", "200000000000000d"));
		Assert.assertEquals(Collections.singletonList(ParserSettings.USAGE_ERROR_STATUS), theExits);
		Assert.assertEquals("Usage: timed [--timeout TIMEOUT]\n"
			+ "error: error processing --timeout: cannot parse \"200000000000000d\" as duration\n", err());
		Assert.assertEquals("", out());
	}

	/** Tests that help and version requests print to the output stream and end successfully */
	@Test
	public void testHelpAndVersion() throws UnsupportedEncodingException {
		Parsed<Args> parsed = theParser.mustParse(new Args(), "--help");
		Assert.assertTrue(parsed.isHelpRequested());
		Assert.assertEquals(Collections.singletonList(0), theExits);
		Assert.assertTrue(out(), out().startsWith("Usage: example [--verbose] INPUT\n"));
		Assert.assertTrue(out(), out().contains("  --version              display version and exit\n"));
		Assert.assertEquals("", err());

		theOut.reset();
		theExits.clear();
		theParser.mustParse(new Args(), "--version");
		Assert.assertEquals(Collections.singletonList(0), theExits);
		Assert.assertEquals("example 2.1\n", out());
	}
}
