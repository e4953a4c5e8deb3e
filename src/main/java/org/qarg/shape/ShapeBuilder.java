package org.qarg.shape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import org.qarg.value.ValueType;
import org.qarg.value.ValueTypes;

import com.google.common.collect.ImmutableList;

/**
 * <p>
 * Declares the fields of one command level. Each field is declared with the name of the destination field (converted to a long option
 * name, e.g. "dryRun" to "--dry-run"), its value type and a setter writing converted values into the caller's destination object.
 * </p>
 * <p>
 * Mistakes in the declaration (colliding names, a multi-value positional that is not last, a required field with a default...) throw
 * {@link ShapeException} as soon as they are made.
 * </p>
 *
 * @param <C> The type of the destination object
 * @param <B> The sub-type of this builder
 */
public abstract class ShapeBuilder<C, B extends ShapeBuilder<C, B>> {
	/** The long name reserved for help requests */
	public static final String HELP_NAME = "help";
	/** The short alias reserved for help requests */
	public static final char HELP_ALIAS = 'h';

	private final String theName;
	private final ImmutableList<String> thePath;
	private final ImmutableList<String> theFieldPrefix;
	private final boolean allowsSubcommands;
	private final List<FieldDescriptor<C>> theFields;
	private final List<SubcommandDescriptor<C, ?>> theSubcommands;
	private final Map<String, FieldDescriptor<C>> theNames;
	private final Map<Character, FieldDescriptor<C>> theShortAliases;
	private final Map<String, SubcommandDescriptor<C, ?>> theCommandNames;
	private String theDescription;
	private String theEpilogue;
	private boolean isSubcommandRequired;
	private CommandShape<C> theBuiltShape;

	/**
	 * @param name The name of the command level
	 * @param path The names of the commands selected to reach this level
	 * @param fieldPrefix The path prefix for this builder's fields
	 * @param subcommands Whether subcommands may be declared on this builder
	 */
	protected ShapeBuilder(String name, List<String> path, List<String> fieldPrefix, boolean subcommands) {
		theName = name;
		thePath = ImmutableList.copyOf(path);
		theFieldPrefix = ImmutableList.copyOf(fieldPrefix);
		allowsSubcommands = subcommands;
		theFields = new ArrayList<>();
		theSubcommands = new ArrayList<>();
		theNames = new HashMap<>();
		theShortAliases = new HashMap<>();
		theCommandNames = new HashMap<>();
	}

	/** @return The name of the command level being built */
	public String getName() {
		return theName;
	}

	/**
	 * Adds a boolean option that takes no value: given as "--name" it binds true. It may also be given as "--name=false".
	 *
	 * @param name The name of the field
	 * @param setter Writes the value into the destination
	 * @param configure Configures the option (optional)
	 * @return This builder
	 */
	public B flag(String name, BiConsumer<? super C, ? super Boolean> setter, Consumer<OptionBuilder<Boolean>> configure) {
		return addField(FieldKind.FLAG, name, ValueTypes.BOOLEAN, null, setter, configure);
	}

	/**
	 * Adds an option that takes exactly one value, given as "--name value" or "--name=value"
	 *
	 * @param <T> The type of the option's value
	 * @param name The name of the field
	 * @param type The type of the option's value
	 * @param setter Writes the value into the destination
	 * @param configure Configures the option (optional)
	 * @return This builder
	 */
	public <T> B option(String name, ValueType<T> type, BiConsumer<? super C, ? super T> setter, Consumer<OptionBuilder<T>> configure) {
		return addField(FieldKind.SCALAR, name, type, null, setter, configure);
	}

	/**
	 * Adds an option collecting any number of values into a list. By default all values following the flag up to the next flag belong
	 * to it ("--ids 1 2 3"); a {@link OptionBuilder#separate() separate} option takes one value per occurrence ("-c a -c b").
	 *
	 * @param <T> The type of the option's values
	 * @param name The name of the field
	 * @param type The type of the option's values
	 * @param setter Writes the list into the destination
	 * @param configure Configures the option (optional)
	 * @return This builder
	 */
	public <T> B listOption(String name, ValueType<T> type, BiConsumer<? super C, ? super List<T>> setter,
		Consumer<OptionBuilder<List<T>>> configure) {
		return addField(FieldKind.MULTI, name, type, null, setter, configure);
	}

	/**
	 * Adds an option collecting any number of "key=value" pairs into a map
	 *
	 * @param <K> The type of the map's keys
	 * @param <V> The type of the map's values
	 * @param name The name of the field
	 * @param keyType The type of the map's keys
	 * @param valueType The type of the map's values
	 * @param setter Writes the map into the destination
	 * @param configure Configures the option (optional)
	 * @return This builder
	 */
	public <K, V> B mapOption(String name, ValueType<K> keyType, ValueType<V> valueType, BiConsumer<? super C, ? super Map<K, V>> setter,
		Consumer<OptionBuilder<Map<K, V>>> configure) {
		if (keyType == null)
			throw new NullPointerException("Key type must not be null");
		return addField(FieldKind.MULTI, name, valueType, keyType, setter, configure);
	}

	/**
	 * Adds an argument identified by its position among the positional arguments of this level. Positional arguments are required
	 * unless they have a default.
	 *
	 * @param <T> The type of the argument's value
	 * @param name The name of the field
	 * @param type The type of the argument's value
	 * @param setter Writes the value into the destination
	 * @param configure Configures the argument (optional)
	 * @return This builder
	 */
	public <T> B positional(String name, ValueType<T> type, BiConsumer<? super C, ? super T> setter, Consumer<OptionBuilder<T>> configure) {
		return addField(FieldKind.POSITIONAL, name, type, null, setter, configure);
	}

	/**
	 * Adds the unbounded trailing positional argument of this level, collecting every positional value left after the other positional
	 * arguments are filled. It must be the last positional argument declared.
	 *
	 * @param <T> The type of the argument's values
	 * @param name The name of the field
	 * @param type The type of the argument's values
	 * @param setter Writes the list into the destination
	 * @param configure Configures the argument (optional)
	 * @return This builder
	 */
	public <T> B positionalList(String name, ValueType<T> type, BiConsumer<? super C, ? super List<T>> setter,
		Consumer<OptionBuilder<List<T>>> configure) {
		return addField(FieldKind.POSITIONAL_MULTI, name, type, null, setter, configure);
	}

	/**
	 * Adds a command that may be selected from this level by naming it as a positional argument. At most one command is selected per
	 * level.
	 *
	 * @param <S> The type of the command's destination
	 * @param name The name selecting the command
	 * @param factory Creates the command's destination when it is selected
	 * @param attach Stores the command's destination in this level's destination when it is selected (optional)
	 * @param configure Declares the fields of the command
	 * @return This builder
	 */
	public <S> B subcommand(String name, Supplier<? extends S> factory, BiConsumer<? super C, ? super S> attach,
		Consumer<CommandBuilder<S>> configure) {
		checkNotBuilt();
		if (!allowsSubcommands)
			throw new ShapeException("Commands cannot be declared in an included group: " + name);
		if (name == null)
			throw new NullPointerException("Name must not be null");
		if (factory == null)
			throw new NullPointerException("Factory must not be null");
		List<String> subPath = new ArrayList<>(thePath.size() + 1);
		subPath.addAll(thePath);
		subPath.add(name);
		CommandBuilder<S> builder = new CommandBuilder<>(name, subPath, subPath, true);
		if (configure != null)
			configure.accept(builder);
		SubcommandDescriptor<C, S> sub = new SubcommandDescriptor<>(name, builder.getAliases(), builder.getHelp(), builder.buildShape(),
			factory, attach);
		List<String> names = new ArrayList<>(sub.getAliases().size() + 1);
		names.add(name);
		names.addAll(sub.getAliases());
		for (String n : names) {
			if (n.isEmpty() || n.startsWith("-"))
				throw new ShapeException("Illegal command name \"" + n + "\"");
			if (theCommandNames.containsKey(n))
				throw new ShapeException("A command named \"" + n + "\" already exists in " + describe());
		}
		for (String n : names)
			theCommandNames.put(n, sub);
		theSubcommands.add(sub);
		return self();
	}

	/**
	 * Flattens the fields of a nested object into this level. The fields are named on the command line as if declared here, but are
	 * written into the object returned by the accessor.
	 *
	 * @param <E> The type of the nested object
	 * @param name The name of the nested object, prefixed to the {@link FieldDescriptor#getPath() paths} of its fields
	 * @param accessor Gets the nested object from the destination
	 * @param configure Declares the fields of the nested object
	 * @return This builder
	 */
	public <E> B include(String name, Function<? super C, ? extends E> accessor, Consumer<CommandBuilder<E>> configure) {
		checkNotBuilt();
		if (name == null)
			throw new NullPointerException("Name must not be null");
		if (accessor == null)
			throw new NullPointerException("Accessor must not be null");
		List<String> prefix = new ArrayList<>(theFieldPrefix.size() + 1);
		prefix.addAll(theFieldPrefix);
		prefix.add(name);
		CommandBuilder<E> builder = new CommandBuilder<>(theName, thePath, prefix, false);
		configure.accept(builder);
		for (FieldDescriptor<E> field : builder.buildShape().getFields())
			addDescriptor(field.<C> through(accessor));
		return self();
	}

	/**
	 * @param description The description printed at the top of this level's help
	 * @return This builder
	 */
	public B withDescription(String description) {
		theDescription = description;
		return self();
	}

	/**
	 * @param epilogue The text printed at the bottom of this level's help
	 * @return This builder
	 */
	public B withEpilogue(String epilogue) {
		theEpilogue = epilogue;
		return self();
	}

	/**
	 * Causes parsing to fail if none of this level's commands is selected
	 *
	 * @return This builder
	 */
	public B requireSubcommand() {
		isSubcommandRequired = true;
		return self();
	}

	/** @return The shape declared by this builder */
	protected final CommandShape<C> buildShape() {
		if (theBuiltShape == null) {
			if (isSubcommandRequired && theSubcommands.isEmpty())
				throw new ShapeException(describe() + " requires a command but declares none");
			theBuiltShape = new CommandShape<>(theName, thePath, theDescription, theEpilogue, theFields, theSubcommands,
				isSubcommandRequired);
		}
		return theBuiltShape;
	}

	/** @return This builder */
	protected B self() {
		return (B) this;
	}

	private <T> B addField(FieldKind kind, String fieldName, ValueType<?> valueType, ValueType<?> keyType,
		BiConsumer<? super C, ? super T> setter, Consumer<OptionBuilder<T>> configure) {
		checkNotBuilt();
		if (fieldName == null)
			throw new NullPointerException("Name must not be null");
		if (fieldName.isEmpty() || fieldName.startsWith("-"))
			throw new ShapeException("Illegal field name \"" + fieldName + "\"");
		if (valueType == null)
			throw new NullPointerException("Type must not be null");
		if (setter == null)
			throw new NullPointerException("Setter must not be null");
		OptionBuilder<T> builder = new OptionBuilder<>(kind, Names.toLongName(fieldName));
		if (configure != null)
			configure.accept(builder);
		String name = builder.getName();
		if (builder.isRequired() && builder.hasDefault())
			throw new ShapeException(describe() + ": " + name + " is required, so it cannot have a default");
		List<String> path = new ArrayList<>(theFieldPrefix.size() + 1);
		path.addAll(theFieldPrefix);
		path.add(name);
		boolean required = builder.isRequired() || (kind == FieldKind.POSITIONAL && !builder.hasDefault());
		FieldDescriptor<C> field = new FieldDescriptor<>(path, kind, name, builder.getShortAlias(), required, builder.hasDefault(),
			builder.getDefault(), builder.getEnvVar(name), builder.getHelp(), builder.isSeparate(), builder.getPlaceholder(name), valueType,
			keyType, (target, value) -> setter.accept(target, (T) value));
		addDescriptor(field);
		return self();
	}

	private void addDescriptor(FieldDescriptor<C> field) {
		String name = field.getName();
		if (!field.getKind().positional && HELP_NAME.equals(name))
			throw new ShapeException("--" + HELP_NAME + " is reserved");
		if (field.getShortAlias() != null && field.getShortAlias() == HELP_ALIAS)
			throw new ShapeException("-" + HELP_ALIAS + " is reserved");
		if (theNames.containsKey(name))
			throw new ShapeException("A field named \"" + name + "\" already exists in " + describe());
		if (field.getShortAlias() != null && theShortAliases.containsKey(field.getShortAlias()))
			throw new ShapeException("Short alias -" + field.getShortAlias() + " of " + name + " is already used by "
				+ theShortAliases.get(field.getShortAlias()).getDisplayName() + " in " + describe());
		if (field.getKind().positional) {
			for (FieldDescriptor<C> other : theFields) {
				if (other.getKind() == FieldKind.POSITIONAL_MULTI) {
					if (field.getKind() == FieldKind.POSITIONAL_MULTI)
						throw new ShapeException(describe() + " declares more than one multi-value positional: " + other.getName() + ", "
							+ name);
					else
						throw new ShapeException("Multi-value positional " + other.getName() + " must be the last positional of "
							+ describe() + ", but " + name + " follows it");
				}
			}
		}
		theNames.put(name, field);
		if (field.getShortAlias() != null)
			theShortAliases.put(field.getShortAlias(), field);
		theFields.add(field);
	}

	private void checkNotBuilt() {
		if (theBuiltShape != null)
			throw new IllegalStateException("This builder has already built its shape");
	}

	private String describe() {
		return thePath.isEmpty() ? theName : "command \"" + String.join(" ", thePath) + "\"";
	}

	/**
	 * Declares the fields of a subcommand or of an included group
	 *
	 * @param <C> The type of the destination object
	 */
	public static class CommandBuilder<C> extends ShapeBuilder<C, CommandBuilder<C>> {
		private final List<String> theAliases;
		private String theHelp;

		CommandBuilder(String name, List<String> path, List<String> fieldPrefix, boolean subcommands) {
			super(name, path, fieldPrefix, subcommands);
			theAliases = new ArrayList<>(2);
		}

		/**
		 * @param aliases Other names that also select this command
		 * @return This builder
		 */
		public CommandBuilder<C> withAliases(String... aliases) {
			theAliases.addAll(Arrays.asList(aliases));
			return this;
		}

		/**
		 * @param help The help text listed for this command in its parent's help
		 * @return This builder
		 */
		public CommandBuilder<C> withHelp(String help) {
			theHelp = help;
			return this;
		}

		List<String> getAliases() {
			return theAliases;
		}

		String getHelp() {
			return theHelp;
		}
	}
}
