package org.qarg.shape;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The immutable description of one command level: its options, its positional arguments in declaration order and the subcommands that
 * may be selected from it. A shape is built once by a {@link ShapeBuilder} and may be shared by any number of parses.
 *
 * @param <C> The type of the destination object this level's fields are written into
 */
public final class CommandShape<C> {
	private final String theName;
	private final ImmutableList<String> thePath;
	private final String theDescription;
	private final String theEpilogue;
	private final ImmutableList<FieldDescriptor<C>> theFields;
	private final ImmutableList<FieldDescriptor<C>> theOptions;
	private final ImmutableList<FieldDescriptor<C>> thePositionals;
	private final ImmutableList<SubcommandDescriptor<C, ?>> theSubcommands;
	private final ImmutableMap<String, FieldDescriptor<C>> theLongNames;
	private final ImmutableMap<Character, FieldDescriptor<C>> theShortAliases;
	private final boolean isSubcommandRequired;

	CommandShape(String name, List<String> path, String description, String epilogue, List<FieldDescriptor<C>> fields,
		List<SubcommandDescriptor<C, ?>> subcommands, boolean subcommandRequired) {
		theName = name;
		thePath = ImmutableList.copyOf(path);
		theDescription = description;
		theEpilogue = epilogue;
		theFields = ImmutableList.copyOf(fields);
		ImmutableList.Builder<FieldDescriptor<C>> options = ImmutableList.builder();
		ImmutableList.Builder<FieldDescriptor<C>> positionals = ImmutableList.builder();
		ImmutableMap.Builder<String, FieldDescriptor<C>> longNames = ImmutableMap.builder();
		ImmutableMap.Builder<Character, FieldDescriptor<C>> shortAliases = ImmutableMap.builder();
		for (FieldDescriptor<C> field : theFields) {
			if (field.getKind().positional)
				positionals.add(field);
			else {
				options.add(field);
				longNames.put(field.getName(), field);
				if (field.getShortAlias() != null)
					shortAliases.put(field.getShortAlias(), field);
			}
		}
		theOptions = options.build();
		thePositionals = positionals.build();
		theLongNames = longNames.build();
		theShortAliases = shortAliases.build();
		theSubcommands = ImmutableList.copyOf(subcommands);
		isSubcommandRequired = subcommandRequired;
	}

	/** @return The name of this level: the program name for the top level, otherwise the command name */
	public String getName() {
		return theName;
	}

	/** @return The names of the commands selected to reach this level, empty for the top level */
	public List<String> getPath() {
		return thePath;
	}

	/** @return The description printed at the top of this level's help, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return The text printed at the bottom of this level's help, or null */
	public String getEpilogue() {
		return theEpilogue;
	}

	/** @return All fields of this level in declaration order */
	public List<FieldDescriptor<C>> getFields() {
		return theFields;
	}

	/** @return The flag-identified fields of this level in declaration order */
	public List<FieldDescriptor<C>> getOptions() {
		return theOptions;
	}

	/** @return The positional fields of this level in declaration order */
	public List<FieldDescriptor<C>> getPositionals() {
		return thePositionals;
	}

	/** @return The commands that may be selected from this level, in declaration order */
	public List<SubcommandDescriptor<C, ?>> getSubcommands() {
		return theSubcommands;
	}

	/** @return Whether parsing fails if this level declares commands but none is selected */
	public boolean isSubcommandRequired() {
		return isSubcommandRequired;
	}

	/**
	 * @param longName The long name of the option
	 * @return The option of this level with the given long name, or null if there is none
	 */
	public FieldDescriptor<C> getOption(String longName) {
		return theLongNames.get(longName);
	}

	/**
	 * @param shortAlias The short alias of the option
	 * @return The option of this level with the given short alias, or null if there is none
	 */
	public FieldDescriptor<C> getOption(char shortAlias) {
		return theShortAliases.get(shortAlias);
	}

	/**
	 * @param name The name or alias of the command
	 * @return The command of this level selected by the given name, or null if there is none
	 */
	public SubcommandDescriptor<C, ?> getSubcommand(String name) {
		for (SubcommandDescriptor<C, ?> sub : theSubcommands) {
			if (sub.matches(name))
				return sub;
		}
		return null;
	}

	/** @return The unbounded trailing positional of this level, or null if it has none */
	public FieldDescriptor<C> getTrailingPositional() {
		if (thePositionals.isEmpty())
			return null;
		FieldDescriptor<C> last = thePositionals.get(thePositionals.size() - 1);
		return last.getKind() == FieldKind.POSITIONAL_MULTI ? last : null;
	}

	@Override
	public String toString() {
		return thePath.isEmpty() ? theName : String.join(" ", thePath);
	}
}
