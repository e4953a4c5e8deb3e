package org.qarg.parse;

/** Tells the {@link Tokenizer} which short aliases are declared at the currently resolved command level */
public interface ShortFlagLookup {
	/**
	 * @param alias The short alias
	 * @return Whether the alias is declared at the resolved level or one of its ancestors
	 */
	boolean isShortFlag(char alias);

	/**
	 * @param alias The short alias
	 * @return Whether the alias is declared and takes a value
	 */
	boolean takesValue(char alias);
}
