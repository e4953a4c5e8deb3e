package org.qarg.shape;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

/**
 * A named branch of a command shape whose fields are bound into a destination of their own, created when the branch is selected
 *
 * @param <P> The type of the parent level's destination
 * @param <S> The type of this command's destination
 */
public final class SubcommandDescriptor<P, S> {
	private final String theName;
	private final ImmutableList<String> theAliases;
	private final String theHelp;
	private final CommandShape<S> theShape;
	private final Supplier<? extends S> theFactory;
	private final BiConsumer<? super P, ? super S> theAttach;

	SubcommandDescriptor(String name, List<String> aliases, String help, CommandShape<S> shape, Supplier<? extends S> factory,
		BiConsumer<? super P, ? super S> attach) {
		theName = name;
		theAliases = ImmutableList.copyOf(aliases);
		theHelp = help;
		theShape = shape;
		theFactory = factory;
		theAttach = attach;
	}

	/** @return The name selecting this command */
	public String getName() {
		return theName;
	}

	/** @return Other names that also select this command */
	public List<String> getAliases() {
		return theAliases;
	}

	/** @return Always {@link FieldKind#SUBCOMMAND} */
	public FieldKind getKind() {
		return FieldKind.SUBCOMMAND;
	}

	/** @return The help text describing this command, or null */
	public String getHelp() {
		return theHelp;
	}

	/** @return The shape of this command's own fields */
	public CommandShape<S> getShape() {
		return theShape;
	}

	/**
	 * @param name The positional text to test
	 * @return Whether the text selects this command
	 */
	public boolean matches(String name) {
		return theName.equals(name) || theAliases.contains(name);
	}

	/** @return A new destination for this command's fields */
	public S create() {
		S created = theFactory.get();
		if (created == null)
			throw new IllegalStateException("Factory for command " + theName + " returned null");
		return created;
	}

	/**
	 * Records the selection of this command in the parent's destination
	 *
	 * @param parent The parent level's destination
	 * @param child This command's destination
	 */
	public void attach(P parent, S child) {
		if (theAttach != null)
			theAttach.accept(parent, child);
	}

	@Override
	public String toString() {
		return theName;
	}
}
