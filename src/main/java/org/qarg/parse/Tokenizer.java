package org.qarg.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * <p>
 * Classifies raw command-line tokens lazily, left to right. Classification of short flags depends on which aliases are declared at the
 * command level resolved at the moment the token is reached, so the tokenizer consults a {@link ShortFlagLookup} as it goes.
 * </p>
 * <p>
 * Rules for short flags:
 * </p>
 * <ul>
 * <li>"-n" is the flag n; "-n=value" is the flag n with an inline value.</li>
 * <li>"-nvalue" is the flag n with the inline value "value" if n is declared and takes a value ("-O5" is "-O 5").</li>
 * <li>"-abc" is the bundle "-a -b -c" if a and b are declared boolean flags and c is any declared flag. Only the last flag of a bundle
 * may take a value, which it takes from the following token.</li>
 * <li>"-5" (a dash and a digit) is positional text, a negative number, unless a digit alias is declared.</li>
 * <li>Anything else starting with a single dash is an unrecognized flag, left for the matcher to report.</li>
 * </ul>
 */
public class Tokenizer implements Iterator<Token> {
	/** The token ending flag processing */
	public static final String TERMINATOR = "--";

	private final List<String> theArgs;
	private final ShortFlagLookup theLookup;
	private final Deque<Token> thePending;
	private int theCursor;
	private boolean isTerminated;

	/**
	 * @param args The raw command-line tokens, excluding the program name
	 * @param lookup Supplies the short aliases declared at the currently resolved level
	 */
	public Tokenizer(List<String> args, ShortFlagLookup lookup) {
		theArgs = args;
		theLookup = lookup;
		thePending = new ArrayDeque<>(4);
	}

	@Override
	public boolean hasNext() {
		return !thePending.isEmpty() || theCursor < theArgs.size();
	}

	@Override
	public Token next() {
		if (!thePending.isEmpty())
			return thePending.removeFirst();
		if (theCursor >= theArgs.size())
			throw new NoSuchElementException();
		String arg = theArgs.get(theCursor++);
		if (isTerminated)
			return Token.positional(arg);
		Token token = classify(arg);
		if (token.getKind() == Token.Kind.TERMINATOR)
			isTerminated = true;
		return token;
	}

	/** @return Whether the terminator has been reached */
	public boolean isTerminated() {
		return isTerminated;
	}

	/**
	 * Consumes the next raw token as the value of the flag just returned
	 *
	 * @return The next token, or null if there is none or it is a flag or the terminator
	 */
	public String nextValue() {
		if (!thePending.isEmpty() || isTerminated || theCursor >= theArgs.size())
			return null;
		String arg = theArgs.get(theCursor);
		if (looksLikeFlag(arg))
			return null;
		theCursor++;
		return arg;
	}

	/**
	 * Consumes every raw token up to the next flag, the terminator or the end of input as values of the flag just returned
	 *
	 * @return The values, possibly empty
	 */
	public List<String> nextValues() {
		List<String> values = new ArrayList<>();
		String value = nextValue();
		while (value != null) {
			values.add(value);
			value = nextValue();
		}
		return values;
	}

	private boolean looksLikeFlag(String arg) {
		if (arg.length() < 2 || arg.charAt(0) != '-')
			return false;
		else if (arg.charAt(1) == '-')
			return true;
		else
			return !isNegativeNumber(arg);
	}

	private boolean isNegativeNumber(String arg) {
		char first = arg.charAt(1);
		return (Character.isDigit(first) || first == '.') && !theLookup.isShortFlag(first);
	}

	private Token classify(String arg) {
		if (TERMINATOR.equals(arg))
			return new Token(Token.Kind.TERMINATOR, arg, null, null);
		else if (arg.startsWith("--")) {
			int equalIdx = arg.indexOf('=');
			if (equalIdx < 0)
				return new Token(Token.Kind.LONG_FLAG, arg, arg.substring(2), null);
			return new Token(Token.Kind.LONG_FLAG, arg.substring(0, equalIdx), arg.substring(2, equalIdx), arg.substring(equalIdx + 1));
		} else if (arg.length() < 2 || arg.charAt(0) != '-' || isNegativeNumber(arg))
			return Token.positional(arg);

		char first = arg.charAt(1);
		if (arg.length() == 2)
			return shortFlag(first, null);
		else if (arg.charAt(2) == '=')
			return shortFlag(first, arg.substring(3));
		else if (theLookup.takesValue(first))
			return shortFlag(first, arg.substring(2));

		int last = arg.length() - 1;
		boolean bundle = theLookup.isShortFlag(arg.charAt(last));
		for (int i = 1; bundle && i < last; i++) {
			char c = arg.charAt(i);
			if (!theLookup.isShortFlag(c) || theLookup.takesValue(c))
				bundle = false;
		}
		if (!bundle)
			return new Token(Token.Kind.SHORT_FLAG, arg, arg.substring(1), null);
		for (int i = 2; i <= last; i++)
			thePending.add(shortFlag(arg.charAt(i), null));
		return shortFlag(first, null);
	}

	private static Token shortFlag(char alias, String inlineValue) {
		return new Token(Token.Kind.SHORT_FLAG, "-" + alias, String.valueOf(alias), inlineValue);
	}
}
