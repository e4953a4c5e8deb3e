package org.qarg.parse;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.qarg.error.ConversionException;
import org.qarg.shape.CommandShape;
import org.qarg.shape.FieldDescriptor;
import org.qarg.shape.FieldKind;
import org.qarg.shape.ShapeBuilder;
import org.qarg.shape.SubcommandDescriptor;

/**
 * The transient state of a single parse: the chain of resolved command levels with their destinations, the fields filled so far and
 * the values collected for multi-value fields. Created and discarded within one parse call.
 */
public class ParseState implements ShortFlagLookup {
	private final List<Level> theLevels;
	private final Map<List<String>, ValueSource> theSources;
	private final Map<FieldDescriptor<?>, Collected> theCollected;
	private final String theVersionName;
	private boolean isHelpRequested;
	private boolean isVersionRequested;

	/**
	 * @param root The top-level shape
	 * @param target The caller's destination for the top-level fields
	 * @param versionName The long name of the implicit version flag, or null if there is none
	 */
	public ParseState(CommandShape<?> root, Object target, String versionName) {
		theLevels = new ArrayList<>(3);
		theSources = new LinkedHashMap<>();
		theCollected = new IdentityHashMap<>();
		theVersionName = versionName;
		activate(new Level((CommandShape<Object>) root, target, null));
	}

	/** @return The resolved command levels, top level first */
	public List<Level> getLevels() {
		return Collections.unmodifiableList(theLevels);
	}

	/** @return The deepest resolved level */
	public Level getCurrent() {
		return theLevels.get(theLevels.size() - 1);
	}

	/** @return The shapes of the resolved levels, top level first */
	public List<CommandShape<?>> getChain() {
		List<CommandShape<?>> chain = new ArrayList<>(theLevels.size());
		for (Level level : theLevels)
			chain.add(level.getShape());
		return chain;
	}

	/** @return The sources of the values of every filled field, by field path */
	public Map<List<String>, ValueSource> getSources() {
		return Collections.unmodifiableMap(theSources);
	}

	/** @return Whether help was requested for the deepest resolved level */
	public boolean isHelpRequested() {
		return isHelpRequested;
	}

	/** @return Whether the program version was requested */
	public boolean isVersionRequested() {
		return isVersionRequested;
	}

	void requestHelp() {
		isHelpRequested = true;
	}

	void requestVersion() {
		isVersionRequested = true;
	}

	/** @return The long name of the implicit version flag, or null if there is none */
	String getVersionName() {
		return theVersionName;
	}

	/**
	 * @param field The field to test
	 * @return Whether the command line or the environment has bound a value to the field
	 */
	public boolean isFilled(FieldDescriptor<?> field) {
		ValueSource source = theSources.get(field.getPath());
		return source != null && source != ValueSource.DEFAULT;
	}

	@Override
	public boolean isShortFlag(char alias) {
		return alias == ShapeBuilder.HELP_ALIAS || findShort(alias) != null;
	}

	@Override
	public boolean takesValue(char alias) {
		FlagMatch match = findShort(alias);
		return match != null && match.getField().getKind().valued;
	}

	/**
	 * @param token The flag token
	 * @return The option matching the flag in the deepest level declaring it, or null if no resolved level declares it
	 */
	public FlagMatch findFlag(Token token) {
		if (token.getKind() == Token.Kind.SHORT_FLAG)
			return token.getName().length() == 1 ? findShort(token.getName().charAt(0)) : null;
		for (int i = theLevels.size() - 1; i >= 0; i--) {
			FieldDescriptor<Object> field = theLevels.get(i).getShape().getOption(token.getName());
			if (field != null)
				return new FlagMatch(theLevels.get(i), field);
		}
		return null;
	}

	/**
	 * @param token A flag token that matches no option of the resolved levels
	 * @return The name of a command selectable from the deepest level that declares the flag, or null
	 */
	public String findUnselectedOwner(Token token) {
		for (SubcommandDescriptor<Object, ?> sub : getCurrent().getShape().getSubcommands()) {
			CommandShape<?> shape = sub.getShape();
			boolean declares;
			if (token.getKind() == Token.Kind.SHORT_FLAG)
				declares = token.getName().length() == 1 && shape.getOption(token.getName().charAt(0)) != null;
			else
				declares = shape.getOption(token.getName()) != null;
			if (declares)
				return sub.getName();
		}
		return null;
	}

	private FlagMatch findShort(char alias) {
		for (int i = theLevels.size() - 1; i >= 0; i--) {
			FieldDescriptor<Object> field = theLevels.get(i).getShape().getOption(alias);
			if (field != null)
				return new FlagMatch(theLevels.get(i), field);
		}
		return null;
	}

	/**
	 * @param field The field to convert the value for
	 * @param text The text of a single value
	 * @return The converted value
	 * @throws ConversionException If the value cannot be converted to the field's type
	 */
	public Object convert(FieldDescriptor<?> field, String text) throws ConversionException {
		return convert(field, text, field.getDisplayName());
	}

	/**
	 * @param field The field to convert the value for
	 * @param text The text of a single value
	 * @param sourceName The name of the value's source for the error message, e.g. "--count" or "environment variable COUNT"
	 * @return The converted value
	 * @throws ConversionException If the value cannot be converted to the field's type
	 */
	public Object convert(FieldDescriptor<?> field, String text, String sourceName) throws ConversionException {
		try {
			return field.convert(text);
		} catch (ParseException | IllegalArgumentException e) {
			throw new ConversionException(sourceName, text, field.getTypeName(), getChain(), e);
		}
	}

	/**
	 * Writes a value into a level's destination and marks the field filled
	 *
	 * @param level The level owning the field
	 * @param field The field to bind
	 * @param value The converted value
	 * @param source Where the value came from
	 */
	public void bind(Level level, FieldDescriptor<Object> field, Object value, ValueSource source) {
		field.bind(level.getTarget(), value);
		theSources.put(field.getPath(), source);
	}

	/**
	 * Collects a value of a multi-value field from the command line. The collected values are bound by {@link #bindCollected()}.
	 *
	 * @param level The level owning the field
	 * @param field The multi-value field
	 * @param values The converted values
	 * @param replace Whether the values replace those collected from earlier occurrences of the field
	 */
	public void collect(Level level, FieldDescriptor<Object> field, List<?> values, boolean replace) {
		Collected collected = theCollected.get(field);
		if (collected == null) {
			collected = new Collected(level);
			theCollected.put(field, collected);
		} else if (replace)
			collected.values.clear();
		collected.values.addAll(values);
	}

	/** Binds the values collected for multi-value fields into their destinations */
	public void bindCollected() {
		for (Map.Entry<FieldDescriptor<?>, Collected> entry : theCollected.entrySet()) {
			FieldDescriptor<Object> field = (FieldDescriptor<Object>) entry.getKey();
			bind(entry.getValue().level, field, field.assemble(entry.getValue().values), ValueSource.COMMAND_LINE);
		}
		theCollected.clear();
	}

	/**
	 * Selects a command from the deepest level, creating its destination and making it the deepest level
	 *
	 * @param sub The command to select
	 * @return The new level
	 */
	public Level select(SubcommandDescriptor<Object, ?> sub) {
		Level parent = getCurrent();
		SubcommandDescriptor<Object, Object> cmd = (SubcommandDescriptor<Object, Object>) sub;
		Object child = cmd.create();
		cmd.attach(parent.getTarget(), child);
		parent.theSelected = cmd;
		Level level = new Level(cmd.getShape(), child, cmd);
		activate(level);
		return level;
	}

	private void activate(Level level) {
		theLevels.add(level);
		for (FieldDescriptor<Object> field : level.getShape().getFields()) {
			if (field.hasDefault()) {
				field.bind(level.getTarget(), field.copyDefault());
				theSources.put(field.getPath(), ValueSource.DEFAULT);
			}
		}
	}

	/** One resolved command level */
	public static class Level {
		private final CommandShape<Object> theShape;
		private final Object theTarget;
		private final SubcommandDescriptor<Object, Object> theSelectedBy;
		private SubcommandDescriptor<Object, Object> theSelected;
		private int thePositionalIndex;

		Level(CommandShape<Object> shape, Object target, SubcommandDescriptor<Object, Object> selectedBy) {
			theShape = shape;
			theTarget = target;
			theSelectedBy = selectedBy;
		}

		/** @return The shape of this level */
		public CommandShape<Object> getShape() {
			return theShape;
		}

		/** @return The destination of this level's fields */
		public Object getTarget() {
			return theTarget;
		}

		/** @return The command whose selection created this level, or null for the top level */
		public SubcommandDescriptor<Object, Object> getSelectedBy() {
			return theSelectedBy;
		}

		/** @return The command selected from this level, or null */
		public SubcommandDescriptor<Object, Object> getSelected() {
			return theSelected;
		}

		/** @return The next single-valued positional of this level not yet given, or null if all have been given */
		FieldDescriptor<Object> nextPositional() {
			List<FieldDescriptor<Object>> positionals = theShape.getPositionals();
			if (thePositionalIndex < positionals.size() && positionals.get(thePositionalIndex).getKind() == FieldKind.POSITIONAL)
				return positionals.get(thePositionalIndex);
			return null;
		}

		void advancePositional() {
			thePositionalIndex++;
		}

		@Override
		public String toString() {
			return theShape.toString();
		}
	}

	/** An option found for a flag token, with the level that declares it */
	public static class FlagMatch {
		private final Level theLevel;
		private final FieldDescriptor<Object> theField;

		FlagMatch(Level level, FieldDescriptor<Object> field) {
			theLevel = level;
			theField = field;
		}

		/** @return The level declaring the option */
		public Level getLevel() {
			return theLevel;
		}

		/** @return The option */
		public FieldDescriptor<Object> getField() {
			return theField;
		}
	}

	private static class Collected {
		final Level level;
		final List<Object> values;

		Collected(Level level) {
			this.level = level;
			values = new ArrayList<>();
		}
	}
}
