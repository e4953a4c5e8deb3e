package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

/** Thrown when positional text fits no positional argument and names no command at the resolved level */
public class AmbiguousSubcommandException extends ArgumentParseException {
	private final String theText;

	/**
	 * @param text The positional text
	 * @param commandChain The command levels resolved when the text was encountered
	 */
	public AmbiguousSubcommandException(String text, List<? extends CommandShape<?>> commandChain) {
		super(createMessage(text, commandChain), commandChain, null);
		theText = text;
	}

	/** @return The positional text that could not be placed */
	public String getText() {
		return theText;
	}

	private static String createMessage(String text, List<? extends CommandShape<?>> commandChain) {
		if (commandChain.get(commandChain.size() - 1).getSubcommands().isEmpty())
			return "too many positional arguments at \"" + text + "\"";
		else
			return "invalid command \"" + text + "\"";
	}
}
