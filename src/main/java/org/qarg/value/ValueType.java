package org.qarg.value;

import java.text.ParseException;

/**
 * Converts the text of a command-line value into a typed value
 *
 * @param <T> The type of value produced
 */
public interface ValueType<T> {
	/** @return The name of the type, as it appears in conversion errors (e.g. "int") */
	String getName();

	/**
	 * @param text The text representing the value as specified on the command line or in the environment
	 * @return The parsed value
	 * @throws ParseException If the value cannot be parsed (either this or {@link IllegalArgumentException} may be thrown)
	 * @throws IllegalArgumentException If the value cannot be parsed (either this or {@link ParseException} may be thrown)
	 */
	T parse(String text) throws ParseException, IllegalArgumentException;

	/**
	 * @param value The value to print
	 * @return The value as it would be specified on the command line, used to render defaults in help
	 */
	default String print(T value) {
		return String.valueOf(value);
	}
}
