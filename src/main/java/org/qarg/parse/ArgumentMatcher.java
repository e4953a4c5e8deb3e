package org.qarg.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.qarg.error.AmbiguousSubcommandException;
import org.qarg.error.MissingValueException;
import org.qarg.error.UnknownFlagException;
import org.qarg.shape.FieldDescriptor;
import org.qarg.shape.ShapeBuilder;
import org.qarg.shape.SubcommandDescriptor;

/**
 * <p>
 * Walks the command-line tokens left to right, binding each to the field it names or fills. Flags are matched against every level
 * resolved so far, the deepest declaring level first. Positional text fills the scalar positionals of the deepest level in declaration
 * order, then selects a command of that level if it names one, then feeds the level's trailing positional.
 * </p>
 * <p>
 * A help request stops matching immediately, leaving the levels resolved so far for the help text. Errors are thrown as soon as they
 * are encountered, so an error earlier on the command line wins over a later help request.
 * </p>
 */
public class ArgumentMatcher {
	private static final Logger log = Logger.getLogger(ArgumentMatcher.class);

	/**
	 * @param state The state of the parse, with the top level activated
	 * @param args The command-line tokens, excluding the program name
	 * @throws org.qarg.error.ArgumentParseException If the tokens cannot be bound
	 */
	public void match(ParseState state, List<String> args) {
		Tokenizer tokens = new Tokenizer(args, state);
		while (tokens.hasNext()) {
			Token token = tokens.next();
			switch (token.getKind()) {
			case TERMINATOR:
				break;
			case POSITIONAL:
				matchPositional(state, token.getText(), tokens.isTerminated());
				break;
			default:
				if (!matchFlag(state, token, tokens))
					return;
				break;
			}
		}
		state.bindCollected();
	}

	/** @return False if the flag requests help or the version, ending the parse */
	private boolean matchFlag(ParseState state, Token token, Tokenizer tokens) {
		if (isHelp(token)) {
			state.requestHelp();
			return false;
		} else if (token.getKind() == Token.Kind.LONG_FLAG && token.getName().equals(state.getVersionName())) {
			state.requestVersion();
			return false;
		}
		ParseState.FlagMatch match = state.findFlag(token);
		if (match == null)
			throw new UnknownFlagException(token.getText(), state.findUnselectedOwner(token), state.getChain());
		FieldDescriptor<Object> field = match.getField();
		switch (field.getKind()) {
		case FLAG:
			Object flagValue = token.getInlineValue() == null ? Boolean.TRUE : state.convert(field, token.getInlineValue());
			state.bind(match.getLevel(), field, flagValue, ValueSource.COMMAND_LINE);
			break;
		case SCALAR:
			String text = token.getInlineValue() != null ? token.getInlineValue() : tokens.nextValue();
			if (text == null)
				throw new MissingValueException(field.getDisplayName(), state.getChain());
			state.bind(match.getLevel(), field, state.convert(field, text), ValueSource.COMMAND_LINE);
			break;
		case MULTI:
			if (field.isSeparate()) {
				String single = token.getInlineValue() != null ? token.getInlineValue() : tokens.nextValue();
				if (single == null)
					throw new MissingValueException(field.getDisplayName(), state.getChain());
				state.collect(match.getLevel(), field, Collections.singletonList(state.convert(field, single)), false);
			} else {
				List<String> texts = token.getInlineValue() != null ? Collections.singletonList(token.getInlineValue())
					: tokens.nextValues();
				if (texts.isEmpty())
					throw new MissingValueException(field.getDisplayName(), state.getChain());
				List<Object> values = new ArrayList<>(texts.size());
				for (String t : texts)
					values.add(state.convert(field, t));
				state.collect(match.getLevel(), field, values, true);
			}
			break;
		default:
			throw new IllegalStateException("Unrecognized option kind: " + field.getKind());
		}
		return true;
	}

	private void matchPositional(ParseState state, String text, boolean terminated) {
		ParseState.Level level = state.getCurrent();
		FieldDescriptor<Object> positional = level.nextPositional();
		if (positional != null) {
			state.bind(level, positional, state.convert(positional, text), ValueSource.COMMAND_LINE);
			level.advancePositional();
			return;
		}
		if (!terminated) {
			SubcommandDescriptor<Object, ?> sub = level.getShape().getSubcommand(text);
			if (sub != null) {
				ParseState.Level selected = state.select(sub);
				if (log.isDebugEnabled())
					log.debug("Selected command " + selected.getShape() + " with \"" + text + "\"");
				return;
			}
		}
		FieldDescriptor<Object> trailing = level.getShape().getTrailingPositional();
		if (trailing == null)
			throw new AmbiguousSubcommandException(text, state.getChain());
		state.collect(level, trailing, Collections.singletonList(state.convert(trailing, text)), false);
	}

	private static boolean isHelp(Token token) {
		if (token.getKind() == Token.Kind.LONG_FLAG)
			return ShapeBuilder.HELP_NAME.equals(token.getName());
		return token.getName().length() == 1 && token.getName().charAt(0) == ShapeBuilder.HELP_ALIAS;
	}
}
