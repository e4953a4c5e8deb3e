package org.qarg.error;

import java.util.List;

import org.qarg.shape.CommandShape;

/** Thrown when a value from the command line or the environment cannot be converted to its field's type */
public class ConversionException extends ArgumentParseException {
	private final String theArgumentName;
	private final String theLiteral;
	private final String theTypeName;

	/**
	 * @param argumentName The display name of the argument (e.g. "--optimize" or "INPUT")
	 * @param literal The text that could not be converted
	 * @param typeName The name of the target type
	 * @param commandChain The command levels resolved when the value was encountered
	 * @param cause The conversion failure
	 */
	public ConversionException(String argumentName, String literal, String typeName, List<? extends CommandShape<?>> commandChain,
		Throwable cause) {
		super("error processing " + argumentName + ": cannot parse \"" + literal + "\" as " + typeName, commandChain, cause);
		theArgumentName = argumentName;
		theLiteral = literal;
		theTypeName = typeName;
	}

	/** @return The display name of the argument (e.g. "--optimize" or "INPUT") */
	public String getArgumentName() {
		return theArgumentName;
	}

	/** @return The text that could not be converted */
	public String getLiteral() {
		return theLiteral;
	}

	/** @return The name of the target type */
	public String getTypeName() {
		return theTypeName;
	}
}
