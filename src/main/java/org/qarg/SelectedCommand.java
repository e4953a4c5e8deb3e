package org.qarg;

import java.util.Objects;

/**
 * The command selected at one level of a parsed command line: either {@link #none() none}, or a named command with the destination its
 * fields were bound into. The command selected beneath it, if any, is available from {@link #getNext()}.
 */
public final class SelectedCommand {
	private static final SelectedCommand NONE = new SelectedCommand(null, null, null);

	private final String theName;
	private final Object thePayload;
	private final SelectedCommand theNext;

	private SelectedCommand(String name, Object payload, SelectedCommand next) {
		theName = name;
		thePayload = payload;
		theNext = next;
	}

	/** @return The selection representing no command selected */
	public static SelectedCommand none() {
		return NONE;
	}

	/**
	 * @param name The name of the selected command
	 * @param payload The destination the command's fields were bound into
	 * @param next The command selected beneath this one
	 * @return The selection
	 */
	public static SelectedCommand of(String name, Object payload, SelectedCommand next) {
		return new SelectedCommand(Objects.requireNonNull(name, "name"), Objects.requireNonNull(payload, "payload"),
			next == null ? NONE : next);
	}

	/** @return Whether a command was selected */
	public boolean isPresent() {
		return theName != null;
	}

	/**
	 * @param name The command name to test
	 * @return Whether the command with the given name was selected
	 */
	public boolean is(String name) {
		return theName != null && theName.equals(name);
	}

	/** @return The name of the selected command */
	public String getName() {
		checkPresent();
		return theName;
	}

	/** @return The destination the selected command's fields were bound into */
	public Object getPayload() {
		checkPresent();
		return thePayload;
	}

	/**
	 * @param <T> The type of the command's destination
	 * @param type The type of the command's destination
	 * @return The destination the selected command's fields were bound into
	 * @throws IllegalStateException If no command was selected
	 * @throws ClassCastException If the destination is not of the given type
	 */
	public <T> T as(Class<T> type) {
		checkPresent();
		return type.cast(thePayload);
	}

	/** @return The command selected beneath this one, or {@link #none()} */
	public SelectedCommand getNext() {
		return theNext == null ? NONE : theNext;
	}

	private void checkPresent() {
		if (theName == null)
			throw new IllegalStateException("No command was selected");
	}

	@Override
	public String toString() {
		if (theName == null)
			return "(none)";
		else if (theNext == null || !theNext.isPresent())
			return theName;
		else
			return theName + " " + theNext;
	}
}
