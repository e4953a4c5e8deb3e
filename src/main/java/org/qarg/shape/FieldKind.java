package org.qarg.shape;

/** The ways a field of a command shape can be given on the command line */
public enum FieldKind {
	/** An option taking exactly one value, e.g. "--name value" */
	SCALAR(false, true, false),
	/** An option taking no value, set to true when given */
	FLAG(false, false, false),
	/** An option taking any number of values, as a list or a map */
	MULTI(false, true, true),
	/** A single value identified by its position */
	POSITIONAL(true, true, false),
	/** The unbounded trailing positional, collecting every remaining positional value */
	POSITIONAL_MULTI(true, true, true),
	/** A branch of nested fields selected by name */
	SUBCOMMAND(false, false, false);

	/** Whether fields of this kind are identified by position rather than a flag */
	public final boolean positional;
	/** Whether fields of this kind take values */
	public final boolean valued;
	/** Whether fields of this kind collect multiple values */
	public final boolean multiple;

	private FieldKind(boolean positional, boolean valued, boolean multiple) {
		this.positional = positional;
		this.valued = valued;
		this.multiple = multiple;
	}
}
