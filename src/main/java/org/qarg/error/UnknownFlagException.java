package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

/** Thrown when a flag matches no option in the resolved command chain */
public class UnknownFlagException extends ArgumentParseException {
	private final String theFlag;

	/**
	 * @param flag The flag as it was given on the command line
	 * @param ownerCommand The name of a not-yet-selected command declaring the flag, or null
	 * @param commandChain The command levels resolved when the flag was encountered
	 */
	public UnknownFlagException(String flag, String ownerCommand, List<? extends CommandShape<?>> commandChain) {
		super("unknown argument " + flag + (ownerCommand == null ? "" : " (an option of command \"" + ownerCommand
			+ "\", which must be named first)"), commandChain, null);
		theFlag = flag;
	}

	/** @return The flag as it was given on the command line */
	public String getFlag() {
		return theFlag;
	}
}
