package org.qarg.shape;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

import org.qarg.value.ValueType;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Static metadata for one configurable field of a command shape: how it is named on the command line, what kind of values it takes and
 * where those values are written in the caller's destination object
 *
 * @param <C> The type of the destination object the field is written into
 */
public final class FieldDescriptor<C> {
	private final ImmutableList<String> thePath;
	private final FieldKind theKind;
	private final String theName;
	private final Character theShortAlias;
	private final boolean isRequired;
	private final boolean hasDefault;
	private final Object theDefault;
	private final String theEnvVar;
	private final String theHelp;
	private final boolean isSeparate;
	private final String thePlaceholder;
	private final ValueType<?> theValueType;
	private final ValueType<?> theKeyType;
	private final BiConsumer<? super C, Object> theBinder;

	FieldDescriptor(List<String> path, FieldKind kind, String name, Character shortAlias, boolean required, boolean hasDefault,
		Object defaultValue, String envVar, String help, boolean separate, String placeholder, ValueType<?> valueType, ValueType<?> keyType,
		BiConsumer<? super C, Object> binder) {
		thePath = ImmutableList.copyOf(path);
		theKind = kind;
		theName = name;
		theShortAlias = shortAlias;
		isRequired = required;
		this.hasDefault = hasDefault;
		theDefault = defaultValue;
		theEnvVar = envVar;
		theHelp = help;
		isSeparate = separate;
		thePlaceholder = placeholder;
		theValueType = valueType;
		theKeyType = keyType;
		theBinder = binder;
	}

	/** @return The names of the command and group levels leading to this field, followed by its own name */
	public List<String> getPath() {
		return thePath;
	}

	/** @return How this field is given on the command line */
	public FieldKind getKind() {
		return theKind;
	}

	/** @return The long name of this option (given as "--name"), or the name of this positional argument */
	public String getName() {
		return theName;
	}

	/** @return The single-character alias of this option (given as "-c"), or null if it has none */
	public Character getShortAlias() {
		return theShortAlias;
	}

	/** @return Whether parsing fails if this field receives no value from the command line, the environment or a default */
	public boolean isRequired() {
		return isRequired;
	}

	/** @return Whether this field declares a default value */
	public boolean hasDefault() {
		return hasDefault;
	}

	/** @return The declared default value, written into the destination before any arguments are bound */
	public Object getDefault() {
		return theDefault;
	}

	/** @return A copy of the default value that a single parse may modify without affecting later parses */
	public Object copyDefault() {
		if (theDefault instanceof Map)
			return new LinkedHashMap<>((Map<?, ?>) theDefault);
		else if (theDefault instanceof List)
			return new ArrayList<>((List<?>) theDefault);
		return theDefault;
	}

	/** @return The name of the environment variable consulted if no argument binds this field, or null */
	public String getEnvVar() {
		return theEnvVar;
	}

	/** @return The help text describing this field, or null */
	public String getHelp() {
		return theHelp;
	}

	/** @return For multi-value options, whether each occurrence contributes one value that accumulates with earlier occurrences */
	public boolean isSeparate() {
		return isSeparate;
	}

	/** @return The name used for this field's values in usage text (e.g. "DATASET") */
	public String getPlaceholder() {
		return thePlaceholder;
	}

	/** @return The type of this field's values (for maps, of the map's values) */
	public ValueType<?> getValueType() {
		return theValueType;
	}

	/** @return The type of this field's keys if it is a map, or null */
	public ValueType<?> getKeyType() {
		return theKeyType;
	}

	/** @return The name of this field as it appears in messages, e.g. "--dataset" or "INPUT" */
	public String getDisplayName() {
		return theKind.positional ? thePlaceholder : "--" + theName;
	}

	/** @return The name of the type this field's text is converted to */
	public String getTypeName() {
		if (theKeyType != null)
			return theKeyType.getName() + "=" + theValueType.getName();
		return theValueType.getName();
	}

	/**
	 * @param text The text of a single value for this field
	 * @return The converted value, or for maps the converted key/value entry
	 * @throws ParseException If the value cannot be parsed (either this or {@link IllegalArgumentException} may be thrown)
	 * @throws IllegalArgumentException If the value cannot be parsed (either this or {@link ParseException} may be thrown)
	 */
	public Object convert(String text) throws ParseException, IllegalArgumentException {
		if (theKeyType == null)
			return theValueType.parse(text);
		int equalIdx = text.indexOf('=');
		if (equalIdx < 0)
			throw new ParseException("Expected key=value: " + text, 0);
		Object key = theKeyType.parse(text.substring(0, equalIdx));
		Object value = theValueType.parse(text.substring(equalIdx + 1));
		return Maps.immutableEntry(key, value);
	}

	/**
	 * @param elements The {@link #convert(String) converted} values of a multi-value field, in order
	 * @return The list or map to bind to the field
	 */
	public Object assemble(List<?> elements) {
		if (theKeyType == null)
			return new ArrayList<>(elements);
		Map<Object, Object> map = new LinkedHashMap<>();
		for (Object element : elements) {
			Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
			map.put(entry.getKey(), entry.getValue());
		}
		return map;
	}

	/**
	 * @param target The destination object to write into
	 * @param value The converted (or for multi-value fields, {@link #assemble(List) assembled}) value
	 */
	public void bind(C target, Object value) {
		theBinder.accept(target, value);
	}

	/** @return The default value as it would be given on the command line, or null if this field has no non-empty default */
	public String printDefault() {
		if (!hasDefault || theDefault == null)
			return null;
		ValueType<Object> valueType = (ValueType<Object>) theValueType;
		if (theKeyType != null) {
			ValueType<Object> keyType = (ValueType<Object>) theKeyType;
			Map<?, ?> map = (Map<?, ?>) theDefault;
			if (map.isEmpty())
				return null;
			List<String> printed = new ArrayList<>(map.size());
			for (Map.Entry<?, ?> entry : map.entrySet())
				printed.add(keyType.print(entry.getKey()) + "=" + valueType.print(entry.getValue()));
			return Joiner.on(' ').join(printed);
		} else if (theKind.multiple) {
			List<?> list = (List<?>) theDefault;
			if (list.isEmpty())
				return null;
			List<String> printed = new ArrayList<>(list.size());
			for (Object value : list)
				printed.add(valueType.print(value));
			return Joiner.on(' ').join(printed);
		} else
			return valueType.print(theDefault);
	}

	/**
	 * Re-targets this field into a nested object of a larger destination
	 *
	 * @param <D> The type of the larger destination
	 * @param accessor Gets the nested object that this field writes into from the larger destination
	 * @return A copy of this field writing through the accessor
	 */
	<D> FieldDescriptor<D> through(Function<? super D, ? extends C> accessor) {
		BiConsumer<? super C, Object> binder = theBinder;
		return new FieldDescriptor<>(thePath, theKind, theName, theShortAlias, isRequired, hasDefault, theDefault, theEnvVar, theHelp,
			isSeparate, thePlaceholder, theValueType, theKeyType, (target, value) -> binder.accept(accessor.apply(target), value));
	}

	@Override
	public String toString() {
		return getDisplayName() + " (" + theKind + ", " + getTypeName() + ")";
	}
}
