package org.qarg.value;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.ParseException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/** Built-in {@link ValueType}s for the common value kinds */
public class ValueTypes {
	private static final Pattern DURATION_PART = Pattern.compile("(\\d+)(ms|s|m|h|d)");

	/** Values are used as-is */
	public static final ValueType<String> STRING = of("string", s -> s);
	/** 32-bit integers */
	public static final ValueType<Integer> INT = of("int", Integer::parseInt);
	/** 64-bit integers */
	public static final ValueType<Long> LONG = of("long", Long::parseLong);
	/** 16-bit integers */
	public static final ValueType<Short> SHORT = of("short", Short::parseShort);
	/** 8-bit integers */
	public static final ValueType<Byte> BYTE = of("byte", Byte::parseByte);
	/** Double-precision floating point */
	public static final ValueType<Double> DOUBLE = of("double", Double::parseDouble);
	/** Single-precision floating point */
	public static final ValueType<Float> FLOAT = of("float", Float::parseFloat);
	/** File system paths, unresolved */
	public static final ValueType<File> FILE = of("file", File::new);

	/** Booleans, accepting true/false, t/f, yes/no, y/n and 1/0 in any case */
	public static final ValueType<Boolean> BOOLEAN = new ValueType<Boolean>() {
		@Override
		public String getName() {
			return "boolean";
		}

		@Override
		public Boolean parse(String text) throws ParseException {
			switch (text.toLowerCase()) {
			case "t":
			case "true":
			case "y":
			case "yes":
			case "1":
				return true;
			case "f":
			case "false":
			case "n":
			case "no":
			case "0":
				return false;
			default:
				throw new ParseException("Unrecognized boolean: " + text, 0);
			}
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** A single character */
	public static final ValueType<Character> CHAR = new ValueType<Character>() {
		@Override
		public String getName() {
			return "char";
		}

		@Override
		public Character parse(String text) throws ParseException {
			if (text.length() != 1)
				throw new ParseException("Expected a single character: " + text, 0);
			return text.charAt(0);
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** Paths on the default file system */
	public static final ValueType<Path> PATH = new ValueType<Path>() {
		@Override
		public String getName() {
			return "path";
		}

		@Override
		public Path parse(String text) throws ParseException {
			try {
				return Paths.get(text);
			} catch (InvalidPathException e) {
				throw new ParseException(e.getMessage(), Math.max(0, e.getIndex()));
			}
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** URIs */
	public static final ValueType<URI> URI_TYPE = new ValueType<URI>() {
		@Override
		public String getName() {
			return "uri";
		}

		@Override
		public URI parse(String text) throws ParseException {
			try {
				return new URI(text);
			} catch (URISyntaxException e) {
				throw new ParseException(e.getMessage(), Math.max(0, e.getIndex()));
			}
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/**
	 * Durations, either ISO-8601 (e.g. "PT1M30S") or a sequence of amounts with units ms, s, m, h or d (e.g. "1m30s")
	 */
	public static final ValueType<Duration> DURATION = new ValueType<Duration>() {
		@Override
		public String getName() {
			return "duration";
		}

		@Override
		public Duration parse(String text) throws ParseException {
			if (text.startsWith("P") || text.startsWith("p")) {
				try {
					return Duration.parse(text);
				} catch (DateTimeParseException e) {
					throw new ParseException(e.getMessage(), e.getErrorIndex());
				}
			}
			Matcher m = DURATION_PART.matcher(text);
			Duration total = Duration.ZERO;
			int end = 0;
			while (m.find()) {
				if (m.start() != end)
					throw new ParseException("Unrecognized duration: " + text, end);
				try {
					long amount = Long.parseLong(m.group(1));
					switch (m.group(2)) {
					case "ms":
						total = total.plusMillis(amount);
						break;
					case "s":
						total = total.plusSeconds(amount);
						break;
					case "m":
						total = total.plusMinutes(amount);
						break;
					case "h":
						total = total.plusHours(amount);
						break;
					default:
						total = total.plusDays(amount);
						break;
					}
				} catch (NumberFormatException | ArithmeticException e) {
					throw new ParseException("Duration too large: " + text, m.start());
				}
				end = m.end();
			}
			if (end == 0 || end != text.length())
				throw new ParseException("Unrecognized duration: " + text, end);
			return total;
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	private ValueTypes() {}

	/**
	 * @param <T> The type of the values
	 * @param name The name of the type
	 * @param parser Parses the values, throwing {@link IllegalArgumentException} (e.g. {@link NumberFormatException}) on failure
	 * @return A value type that parses with the given function
	 */
	public static <T> ValueType<T> of(String name, Function<String, ? extends T> parser) {
		Preconditions.checkNotNull(name, "Name must not be null");
		Preconditions.checkNotNull(parser, "Parser must not be null");
		return new ValueType<T>() {
			@Override
			public String getName() {
				return name;
			}

			@Override
			public T parse(String text) {
				return parser.apply(text);
			}

			@Override
			public String toString() {
				return name;
			}
		};
	}

	/**
	 * Values are matched against the constant names first, then against {@link Object#toString()} in case the enum prints prettier
	 * values
	 *
	 * @param <E> The enum type
	 * @param enumType The enum type
	 * @return A value type for constants of the enum
	 */
	public static <E extends Enum<E>> ValueType<E> enumType(Class<E> enumType) {
		Preconditions.checkNotNull(enumType, "Enum type must not be null");
		return new ValueType<E>() {
			@Override
			public String getName() {
				return enumType.getSimpleName();
			}

			@Override
			public E parse(String text) throws ParseException {
				for (E value : enumType.getEnumConstants()) {
					if (value.name().equals(text))
						return value;
				}
				for (E value : enumType.getEnumConstants()) {
					if (value.toString().equals(text))
						return value;
				}
				throw new ParseException("No such " + enumType.getSimpleName() + " value named \"" + text + "\"", 0);
			}

			@Override
			public String print(E value) {
				return value.name();
			}

			@Override
			public String toString() {
				return getName();
			}
		};
	}

	/**
	 * @param pattern The pattern that values must match in full
	 * @return A value type producing the successful {@link Matcher} for each value
	 */
	public static ValueType<Matcher> pattern(String pattern) {
		return pattern(Pattern.compile(pattern));
	}

	/**
	 * @param pattern The pattern that values must match in full
	 * @return A value type producing the successful {@link Matcher} for each value
	 */
	public static ValueType<Matcher> pattern(Pattern pattern) {
		Preconditions.checkNotNull(pattern, "Pattern must not be null");
		return new ValueType<Matcher>() {
			@Override
			public String getName() {
				return "string matching " + pattern.pattern();
			}

			@Override
			public Matcher parse(String text) throws ParseException {
				Matcher m = pattern.matcher(text);
				if (!m.matches())
					throw new ParseException("Argument does not match \"" + pattern.pattern() + "\": " + text, 0);
				return m;
			}

			@Override
			public String print(Matcher value) {
				return value.group();
			}

			@Override
			public String toString() {
				return pattern.pattern();
			}
		};
	}
}
