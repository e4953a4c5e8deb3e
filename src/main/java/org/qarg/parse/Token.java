package org.qarg.parse;

/** A classified command-line token */
public final class Token {
	/** The kinds of tokens */
	public enum Kind {
		/** A flag given by its long name, e.g. "--name" or "--name=value" */
		LONG_FLAG,
		/** A flag given by its short alias, e.g. "-n", "-n=value", "-n5" or one flag of a bundle like "-abc" */
		SHORT_FLAG,
		/** Text that is not a flag */
		POSITIONAL,
		/** The literal "--", after which every token is positional */
		TERMINATOR;
	}

	private final Kind theKind;
	private final String theText;
	private final String theName;
	private final String theInlineValue;

	Token(Kind kind, String text, String name, String inlineValue) {
		theKind = kind;
		theText = text;
		theName = name;
		theInlineValue = inlineValue;
	}

	static Token positional(String text) {
		return new Token(Kind.POSITIONAL, text, null, null);
	}

	/** @return The kind of this token */
	public Kind getKind() {
		return theKind;
	}

	/** @return Whether this token is a long or short flag */
	public boolean isFlag() {
		return theKind == Kind.LONG_FLAG || theKind == Kind.SHORT_FLAG;
	}

	/** @return The flag as it should be named in messages (e.g. "--name" or "-n"), or the text of a positional token */
	public String getText() {
		return theText;
	}

	/** @return The name of the flag without dashes, or null for other tokens */
	public String getName() {
		return theName;
	}

	/** @return The value given in the same token as the flag (e.g. "value" for "--name=value"), or null */
	public String getInlineValue() {
		return theInlineValue;
	}

	@Override
	public String toString() {
		return theInlineValue == null ? theText : theText + "=" + theInlineValue;
	}
}
