package org.qarg.parse;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;
import org.qarg.ArgParser;
import org.qarg.ArgParsing;
import org.qarg.Parsed;
import org.qarg.error.ConversionException;
import org.qarg.error.MissingRequiredException;
import org.qarg.value.ValueTypes;

/** Tests the precedence of command-line, environment and default values, and the checking of required arguments */
public class PrecedenceResolverTest {
	static class Settings {
		String dataset;
		int workers;
		List<Integer> ports;
		String input;
		Deploy deploy;
	}

	static class Deploy {
		String target;
	}

	private static ArgParser<Settings> parser(String envPrefix) {
		return ArgParsing.<Settings> build("app")//
			.withEnvPrefix(envPrefix)//
			.option("dataset", ValueTypes.STRING, (s, v) -> s.dataset = v, o -> o.fromEnv().withDefault("builtin"))//
			.option("workers", ValueTypes.INT, (s, v) -> s.workers = v, o -> o.fromEnv("NUM_WORKERS"))//
			.listOption("ports", ValueTypes.INT, (s, v) -> s.ports = v, o -> o.fromEnv())//
			.positional("input", ValueTypes.STRING, (s, v) -> s.input = v, o -> o.fromEnv())//
			.subcommand("deploy", Deploy::new, (s, d) -> s.deploy = d, cmd -> cmd//
				.option("target", ValueTypes.STRING, (d, v) -> d.target = v, o -> o.required().fromEnv("DEPLOY_TARGET")))//
			.build();
	}

	private static Map<String, String> env(String... keyValues) {
		Map<String, String> env = new HashMap<>();
		for (int i = 0; i < keyValues.length; i += 2)
			env.put(keyValues[i], keyValues[i + 1]);
		return env;
	}

	/** Tests that the command line wins over the environment, which wins over defaults */
	@Test
	public void testPrecedence() {
		ArgParser<Settings> parser = parser(null);
		Parsed<Settings> parsed = parser.parse(new Settings(), Arrays.asList("in"), Collections.emptyMap());
		Assert.assertEquals("builtin", parsed.getConfig().dataset);
		Assert.assertEquals(ValueSource.DEFAULT, parsed.getSource("dataset"));

		parsed = parser.parse(new Settings(), Arrays.asList("in"), env("DATASET", "from-env"));
		Assert.assertEquals("from-env", parsed.getConfig().dataset);
		Assert.assertEquals(ValueSource.ENVIRONMENT, parsed.getSource("dataset"));

		parsed = parser.parse(new Settings(), Arrays.asList("in", "--dataset", "from-cli"), env("DATASET", "from-env"));
		Assert.assertEquals("from-cli", parsed.getConfig().dataset);
		Assert.assertEquals(ValueSource.COMMAND_LINE, parsed.getSource("dataset"));
	}

	/** Tests explicit and prefixed environment names, and comma-separated values for multi-value fields */
	@Test
	public void testEnvironmentNames() {
		Parsed<Settings> parsed = parser(null).parse(new Settings(), Collections.emptyList(),
			env("NUM_WORKERS", "4", "PORTS", "80, 443,8080", "INPUT", "env-input"));
		Assert.assertEquals(4, parsed.getConfig().workers);
		Assert.assertEquals(Arrays.asList(80, 443, 8080), parsed.getConfig().ports);
		Assert.assertEquals("env-input", parsed.getConfig().input);
		Assert.assertEquals(ValueSource.ENVIRONMENT, parsed.getSource("input"));

		parsed = parser("APP_").parse(new Settings(), Arrays.asList("in"), env("NUM_WORKERS", "4", "APP_NUM_WORKERS", "6"));
		Assert.assertEquals(6, parsed.getConfig().workers);
		// Help and required-argument errors name the same prefixed variables that are read
		Assert.assertTrue(parser("APP_").getHelp(), parser("APP_").getHelp().contains("[env: APP_NUM_WORKERS]"));
		try {
			parser("APP_").parse(new Settings(), Arrays.asList("in", "deploy"), env("DEPLOY_TARGET", "prod"));
			Assert.fail("Read an unprefixed variable");
		} catch (MissingRequiredException e) {
			Assert.assertEquals("APP_DEPLOY_TARGET", e.getEnvVar());
		}

		// Command-line values of multi-value fields replace the environment's entirely
		parsed = parser(null).parse(new Settings(), Arrays.asList("in", "--ports", "1"), env("PORTS", "80,443"));
		Assert.assertEquals(Arrays.asList(1), parsed.getConfig().ports);
	}

	/** Tests environment values that cannot be converted */
	@Test
	public void testEnvironmentConversion() {
		try {
			parser(null).parse(new Settings(), Arrays.asList("in"), env("NUM_WORKERS", "many"));
			Assert.fail("Expected a conversion error");
		} catch (ConversionException e) {
			Assert.assertEquals("error processing environment variable NUM_WORKERS: cannot parse \"many\" as int", e.getMessage());
		}
		// Not consulted if the command line gives the value
		Parsed<Settings> parsed = parser(null).parse(new Settings(), Arrays.asList("in", "--workers", "2"),
			env("NUM_WORKERS", "many"));
		Assert.assertEquals(2, parsed.getConfig().workers);
	}

	/** Tests the checking of required fields over the resolved commands only */
	@Test
	public void testRequired() {
		ArgParser<Settings> parser = parser(null);
		try {
			parser.parse(new Settings(), Arrays.asList("in", "deploy"), Collections.emptyMap());
			Assert.fail("Expected a missing argument");
		} catch (MissingRequiredException e) {
			Assert.assertEquals("--target is required (or environment variable DEPLOY_TARGET)", e.getMessage());
			Assert.assertEquals("DEPLOY_TARGET", e.getEnvVar());
			Assert.assertEquals("deploy", e.getResolvedShape().getName());
		}
		Parsed<Settings> parsed = parser.parse(new Settings(), Arrays.asList("in", "deploy"), env("DEPLOY_TARGET", "prod"));
		Assert.assertEquals("prod", parsed.getConfig().deploy.target);
		Assert.assertEquals(ValueSource.ENVIRONMENT, parsed.getSource("deploy", "target"));

		// The environment of an unselected command is not consulted
		parsed = parser.parse(new Settings(), Arrays.asList("in"), env("DEPLOY_TARGET", "prod"));
		Assert.assertNull(parsed.getConfig().deploy);
		Assert.assertNull(parsed.getSource("deploy", "target"));

		try {
			parser.parse(new Settings(), Collections.emptyList(), Collections.emptyMap());
			Assert.fail("Expected a missing positional");
		} catch (MissingRequiredException e) {
			Assert.assertEquals("INPUT is required (or environment variable INPUT)", e.getMessage());
		}

		ArgParser<Settings> commandRequired = ArgParsing.<Settings> build("app")//
			.subcommand("deploy", Deploy::new, (s, d) -> s.deploy = d, null)//
			.requireSubcommand()//
			.build();
		try {
			commandRequired.parse(new Settings());
			Assert.fail("Expected a missing command");
		} catch (MissingRequiredException e) {
			Assert.assertEquals("command is required", e.getMessage());
		}
		Assert.assertNotNull(commandRequired.parse(new Settings(), "deploy").getConfig().deploy);
	}

	/** Tests that neither the environment nor required fields are checked when help is requested */
	@Test
	public void testHelpSkipsResolution() {
		Parsed<Settings> parsed = parser(null).parse(new Settings(), Arrays.asList("deploy", "--help"), env("NUM_WORKERS", "many"));
		Assert.assertTrue(parsed.isHelpRequested());
		Assert.assertEquals(0, parsed.getConfig().workers);
	}
}
