package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

/** Thrown when a required argument was given by neither the command line, the environment, nor a default */
public class MissingRequiredException extends ArgumentParseException {
	private final String theArgumentName;
	private final String theEnvVar;

	/**
	 * @param argumentName The display name of the missing argument
	 * @param commandChain The command levels resolved at the end of input
	 */
	public MissingRequiredException(String argumentName, List<? extends CommandShape<?>> commandChain) {
		this(argumentName, null, commandChain);
	}

	/**
	 * @param argumentName The display name of the missing argument
	 * @param envVar The environment variable that could also have supplied the argument, or null
	 * @param commandChain The command levels resolved at the end of input
	 */
	public MissingRequiredException(String argumentName, String envVar, List<? extends CommandShape<?>> commandChain) {
		super(argumentName + " is required" + (envVar == null ? "" : " (or environment variable " + envVar + ")"), commandChain, null);
		theArgumentName = argumentName;
		theEnvVar = envVar;
	}

	/** @return The display name of the missing argument */
	public String getArgumentName() {
		return theArgumentName;
	}

	/** @return The environment variable that could also have supplied the argument, or null */
	public String getEnvVar() {
		return theEnvVar;
	}
}
