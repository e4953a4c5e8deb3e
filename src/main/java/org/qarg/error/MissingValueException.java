package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

/** Thrown when an option that takes a value is not followed by one */
public class MissingValueException extends ArgumentParseException {
	private final String theFlag;

	/**
	 * @param flag The flag missing its value
	 * @param commandChain The command levels resolved when the flag was encountered
	 */
	public MissingValueException(String flag, List<? extends CommandShape<?>> commandChain) {
		super("missing value for " + flag, commandChain, null);
		theFlag = flag;
	}

	/** @return The flag missing its value */
	public String getFlag() {
		return theFlag;
	}
}
