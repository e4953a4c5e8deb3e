package org.qarg.parse;

/** Where the value of a field came from. The sources are listed in precedence order. */
public enum ValueSource {
	/** A command-line argument */
	COMMAND_LINE,
	/** An environment variable */
	ENVIRONMENT,
	/** The field's declared default */
	DEFAULT;
}
