package org.qarg.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.qarg.ParserSettings;
import org.qarg.error.MissingRequiredException;
import org.qarg.shape.FieldDescriptor;

import com.google.common.base.Splitter;

/**
 * Fills the fields the command line left unset from the environment, then verifies that every required field of the resolved command
 * chain has a value. The command line always wins over the environment, and the environment over declared defaults.
 */
public class PrecedenceResolver {
	private static final Logger log = Logger.getLogger(PrecedenceResolver.class);
	private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	private final Map<String, String> theEnvironment;
	private final ParserSettings theSettings;

	/**
	 * @param environment The environment variables to consult
	 * @param settings The parser's settings, supplying the prefix of environment variable names
	 */
	public PrecedenceResolver(Map<String, String> environment, ParserSettings settings) {
		theEnvironment = environment == null ? Collections.emptyMap() : environment;
		theSettings = settings;
	}

	/**
	 * @param field The field
	 * @return The name of the environment variable consulted for the field, with any prefix, or null if the field declares none
	 */
	public String getEnvName(FieldDescriptor<?> field) {
		return theSettings.getEnvName(field.getEnvVar());
	}

	/**
	 * Binds environment values to the fields of the resolved levels that the command line did not fill. Values of multi-value fields
	 * are comma-separated.
	 *
	 * @param state The state of the parse, after matching
	 * @throws org.qarg.error.ConversionException If an environment value cannot be converted to its field's type
	 */
	public void resolve(ParseState state) {
		for (ParseState.Level level : state.getLevels()) {
			for (FieldDescriptor<Object> field : level.getShape().getFields()) {
				String envName = getEnvName(field);
				if (envName == null || state.isFilled(field))
					continue;
				String text = theEnvironment.get(envName);
				if (text == null)
					continue;
				String sourceName = "environment variable " + envName;
				Object value;
				if (field.getKind().multiple) {
					List<Object> values = new ArrayList<>();
					for (String element : LIST_SPLITTER.split(text))
						values.add(state.convert(field, element, sourceName));
					value = field.assemble(values);
				} else
					value = state.convert(field, text, sourceName);
				state.bind(level, field, value, ValueSource.ENVIRONMENT);
				if (log.isDebugEnabled())
					log.debug(field.getDisplayName() + " bound from " + sourceName);
			}
		}
	}

	/**
	 * @param state The state of the parse, after {@link #resolve(ParseState) resolution}
	 * @throws MissingRequiredException If a required field of a resolved level has no value, or a level requiring a command has none
	 *         selected
	 */
	public void checkRequired(ParseState state) {
		for (ParseState.Level level : state.getLevels()) {
			for (FieldDescriptor<Object> field : level.getShape().getFields()) {
				if (field.isRequired() && !state.isFilled(field))
					throw new MissingRequiredException(field.getDisplayName(), getEnvName(field), state.getChain());
			}
			if (level.getShape().isSubcommandRequired() && level.getSelected() == null)
				throw new MissingRequiredException("command", state.getChain());
		}
	}
}
