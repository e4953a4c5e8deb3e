package org.qarg.shape;

/**
 * Configures a single field while it is being added to a {@link ShapeBuilder}
 *
 * @param <T> The type of the field's value
 */
public class OptionBuilder<T> {
	private final FieldKind theKind;
	private String theName;
	private Character theShortAlias;
	private boolean isRequired;
	private boolean hasDefault;
	private T theDefault;
	private String theEnvVar;
	private boolean isEnvDerived;
	private String theHelp;
	private boolean isSeparate;
	private String thePlaceholder;

	OptionBuilder(FieldKind kind, String name) {
		theKind = kind;
		theName = name;
	}

	/** @return The kind of field being configured */
	public FieldKind getKind() {
		return theKind;
	}

	/**
	 * @param name The long name for the option (given as "--name"), replacing the one derived from the field name
	 * @return This builder
	 */
	public OptionBuilder<T> named(String name) {
		if (name == null || name.isEmpty())
			throw new ShapeException("Name must not be empty");
		theName = name;
		return this;
	}

	/**
	 * @param alias The single-character alias for the option (given as "-c")
	 * @return This builder
	 */
	public OptionBuilder<T> withShort(char alias) {
		if (theKind.positional)
			throw new ShapeException("Positional argument " + theName + " cannot have a short alias");
		if (alias == '-' || alias == '=' || Character.isWhitespace(alias))
			throw new ShapeException("Illegal short alias '" + alias + "' for " + theName);
		theShortAlias = alias;
		return this;
	}

	/**
	 * @param help The help text describing the field
	 * @return This builder
	 */
	public OptionBuilder<T> withHelp(String help) {
		theHelp = help;
		return this;
	}

	/**
	 * Causes parsing to fail if the field receives no value from the command line or the environment. A required field cannot have a
	 * default.
	 *
	 * @return This builder
	 */
	public OptionBuilder<T> required() {
		isRequired = true;
		return this;
	}

	/**
	 * @param value The value to write into the destination before any arguments are bound. A required field cannot have a default.
	 * @return This builder
	 */
	public OptionBuilder<T> withDefault(T value) {
		hasDefault = true;
		theDefault = value;
		return this;
	}

	/**
	 * @param envVar The name of the environment variable to consult if no command-line argument binds the field
	 * @return This builder
	 */
	public OptionBuilder<T> fromEnv(String envVar) {
		if (envVar == null || envVar.isEmpty())
			throw new ShapeException("Environment variable name must not be empty");
		theEnvVar = envVar;
		isEnvDerived = false;
		return this;
	}

	/**
	 * Consults the environment variable named like the field, e.g. "DRY_RUN" for "--dry-run"
	 *
	 * @return This builder
	 */
	public OptionBuilder<T> fromEnv() {
		isEnvDerived = true;
		theEnvVar = null;
		return this;
	}

	/**
	 * Makes a multi-value option take exactly one value per occurrence, accumulating the values of repeated occurrences. By default a
	 * multi-value option takes every value following it up to the next flag, and a repeated occurrence replaces the earlier values.
	 *
	 * @return This builder
	 */
	public OptionBuilder<T> separate() {
		if (theKind != FieldKind.MULTI)
			throw new ShapeException("Only multi-value options may be separate: " + theName);
		isSeparate = true;
		return this;
	}

	/**
	 * @param placeholder The name to use for the field's values in usage text, replacing the one derived from the name
	 * @return This builder
	 */
	public OptionBuilder<T> withPlaceholder(String placeholder) {
		thePlaceholder = placeholder;
		return this;
	}

	String getName() {
		return theName;
	}

	Character getShortAlias() {
		return theShortAlias;
	}

	boolean isRequired() {
		return isRequired;
	}

	boolean hasDefault() {
		return hasDefault;
	}

	T getDefault() {
		return theDefault;
	}

	String getEnvVar(String longName) {
		if (isEnvDerived)
			return Names.toConstantName(longName);
		return theEnvVar;
	}

	String getHelp() {
		return theHelp;
	}

	boolean isSeparate() {
		return isSeparate;
	}

	String getPlaceholder(String longName) {
		return thePlaceholder != null ? thePlaceholder : Names.toConstantName(longName);
	}
}
