package org.qarg;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.qarg.parse.ParseState;
import org.qarg.parse.ValueSource;
import org.qarg.shape.CommandShape;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The result of parsing a command line: the caller's destination, with the command selection and the source of each bound value
 *
 * @param <C> The type of the destination object
 */
public final class Parsed<C> {
	private final C theConfig;
	private final ImmutableList<CommandShape<?>> theCommandChain;
	private final SelectedCommand theCommand;
	private final ImmutableMap<List<String>, ValueSource> theSources;
	private final boolean isHelpRequested;
	private final boolean isVersionRequested;

	Parsed(C config, ParseState state) {
		theConfig = config;
		theCommandChain = ImmutableList.copyOf(state.getChain());
		SelectedCommand command = SelectedCommand.none();
		List<ParseState.Level> levels = state.getLevels();
		for (int i = levels.size() - 1; i > 0; i--)
			command = SelectedCommand.of(levels.get(i).getSelectedBy().getName(), levels.get(i).getTarget(), command);
		theCommand = command;
		theSources = ImmutableMap.copyOf(state.getSources());
		isHelpRequested = state.isHelpRequested();
		isVersionRequested = state.isVersionRequested();
	}

	/** @return The destination the top-level fields were bound into */
	public C getConfig() {
		return theConfig;
	}

	/** @return The command selected from the top level, or {@link SelectedCommand#none()} */
	public SelectedCommand getCommand() {
		return theCommand;
	}

	/** @return The resolved command levels, top level first */
	public List<CommandShape<?>> getCommandChain() {
		return theCommandChain;
	}

	/** @return The deepest resolved command level */
	public CommandShape<?> getResolvedShape() {
		return theCommandChain.get(theCommandChain.size() - 1);
	}

	/** @return Whether the command line asked for help, in which case required arguments and the environment were not checked */
	public boolean isHelpRequested() {
		return isHelpRequested;
	}

	/** @return Whether the command line asked for the program version */
	public boolean isVersionRequested() {
		return isVersionRequested;
	}

	/**
	 * @param path The path of the field: the names of the selected commands and included groups leading to it, then its name
	 * @return Where the field's value came from, or null if it was never set
	 */
	public ValueSource getSource(String... path) {
		return theSources.get(Arrays.asList(path));
	}

	/** @return The sources of the values of every set field, by field path */
	public Map<List<String>, ValueSource> getSources() {
		return theSources;
	}

	@Override
	public String toString() {
		return theConfig + (theCommand.isPresent() ? " " + theCommand : "");
	}
}
