package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when command-line arguments cannot be bound to a command shape. Each exception remembers the chain of command levels that had
 * been resolved when parsing failed, so that the usage for that level can be printed alongside the message.
 */
public abstract class ArgumentParseException extends IllegalArgumentException {
	private final transient ImmutableList<CommandShape<?>> theCommandChain;

	/**
	 * @param message The message for the exception
	 * @param commandChain The command levels resolved when the failure occurred, top level first
	 * @param cause The cause of the exception, or null
	 */
	protected ArgumentParseException(String message, List<? extends CommandShape<?>> commandChain, Throwable cause) {
		super(message, cause);
		theCommandChain = ImmutableList.copyOf(commandChain);
	}

	/** @return The command levels resolved when the failure occurred, top level first */
	public List<CommandShape<?>> getCommandChain() {
		return theCommandChain;
	}

	/** @return The deepest command level resolved when the failure occurred */
	public CommandShape<?> getResolvedShape() {
		return theCommandChain.get(theCommandChain.size() - 1);
	}
}
