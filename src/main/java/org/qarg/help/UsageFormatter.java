package org.qarg.help;

import java.util.ArrayList;
import java.util.List;

import org.qarg.ParserSettings;
import org.qarg.shape.CommandShape;
import org.qarg.shape.FieldDescriptor;
import org.qarg.shape.FieldKind;
import org.qarg.shape.ShapeBuilder;
import org.qarg.shape.SubcommandDescriptor;

import com.google.common.base.Strings;

/**
 * <p>
 * Renders the usage synopsis and the help text of a resolved command level, e.g.
 * </p>
 *
 * <pre>
 * Usage: example [--verbose] [--dataset DATASET] [--optimize OPTIMIZE] INPUT [OUTPUT [OUTPUT ...]]
 *
 * Positional arguments:
 *   INPUT
 *   OUTPUT
 *
 * Options:
 *   --verbose, -v          verbosity level
 *   --dataset DATASET      dataset to use
 *   --optimize OPTIMIZE, -O OPTIMIZE
 *                          optimization level
 *   --help, -h             display this help and exit
 * </pre>
 * <p>
 * Entries too long for the help column have their help text on the following line.
 * </p>
 */
public class UsageFormatter {
	private static final String INDENT = "  ";
	private static final String GAP = "  ";

	private final ParserSettings theSettings;

	/** @param settings The settings of the parser whose help to render */
	public UsageFormatter(ParserSettings settings) {
		theSettings = settings;
	}

	/**
	 * @param chain The resolved command levels, top level first
	 * @return The one-line usage synopsis of the deepest level, without a line terminator
	 */
	public String synopsis(List<? extends CommandShape<?>> chain) {
		CommandShape<?> shape = chain.get(chain.size() - 1);
		StringBuilder str = new StringBuilder("Usage: ").append(programName(chain));
		for (FieldDescriptor<?> option : shape.getOptions()) {
			str.append(' ');
			if (option.isRequired())
				appendOptionSynopsis(str, option);
			else {
				str.append('[');
				appendOptionSynopsis(str, option);
				str.append(']');
			}
		}
		for (FieldDescriptor<?> positional : shape.getPositionals()) {
			str.append(' ');
			String ph = positional.getPlaceholder();
			if (positional.getKind() == FieldKind.POSITIONAL_MULTI) {
				if (positional.isRequired())
					str.append(ph).append(" [").append(ph).append(" ...]");
				else
					str.append('[').append(ph).append(" [").append(ph).append(" ...]]");
			} else if (positional.isRequired())
				str.append(ph);
			else
				str.append('[').append(ph).append(']');
		}
		return str.toString();
	}

	/**
	 * @param chain The resolved command levels, top level first
	 * @return The full help text of the deepest level
	 */
	public String help(List<? extends CommandShape<?>> chain) {
		CommandShape<?> shape = chain.get(chain.size() - 1);
		List<String[]> positionals = new ArrayList<>();
		for (FieldDescriptor<?> positional : shape.getPositionals())
			positionals.add(new String[] { positional.getPlaceholder(), describe(positional) });
		List<String[]> options = new ArrayList<>();
		for (FieldDescriptor<?> option : shape.getOptions())
			options.add(new String[] { optionEntry(option), describe(option) });
		options.add(new String[] { "--" + ShapeBuilder.HELP_NAME + ", -" + ShapeBuilder.HELP_ALIAS, "display this help and exit" });
		if (theSettings.getVersionName() != null)
			options.add(new String[] { "--" + theSettings.getVersionName(), "display version and exit" });
		List<String[]> commands = new ArrayList<>();
		for (SubcommandDescriptor<?, ?> sub : shape.getSubcommands())
			commands.add(new String[] { sub.getName(), sub.getHelp() });

		int column = theSettings.getHelpColumn();
		if (theSettings.isHelpColumnFitted()) {
			int longest = Math.max(longest(positionals), Math.max(longest(options), longest(commands)));
			column = Math.min(column, INDENT.length() + longest + GAP.length());
		}

		StringBuilder str = new StringBuilder();
		if (shape.getDescription() != null)
			str.append(shape.getDescription()).append('\n');
		str.append(synopsis(chain)).append('\n');
		if (!positionals.isEmpty()) {
			str.append("\nPositional arguments:\n");
			appendEntries(str, positionals, column);
		}
		str.append("\nOptions:\n");
		appendEntries(str, options, column);
		if (!commands.isEmpty()) {
			str.append("\nCommands:\n");
			appendEntries(str, commands, column);
		}
		if (shape.getEpilogue() != null)
			str.append('\n').append(shape.getEpilogue()).append('\n');
		return str.toString();
	}

	/**
	 * @param chain The resolved command levels, top level first
	 * @return The program name followed by the names of the selected commands
	 */
	public static String programName(List<? extends CommandShape<?>> chain) {
		StringBuilder str = new StringBuilder(chain.get(0).getName());
		for (int i = 1; i < chain.size(); i++)
			str.append(' ').append(chain.get(i).getName());
		return str.toString();
	}

	private static void appendOptionSynopsis(StringBuilder str, FieldDescriptor<?> option) {
		str.append("--").append(option.getName());
		if (option.getKind() == FieldKind.FLAG)
			return;
		str.append(' ').append(option.getPlaceholder());
		if (option.getKind() == FieldKind.MULTI && !option.isSeparate())
			str.append(" [").append(option.getPlaceholder()).append(" ...]");
	}

	private static String optionEntry(FieldDescriptor<?> option) {
		StringBuilder str = new StringBuilder("--").append(option.getName());
		String value = option.getKind() == FieldKind.FLAG ? "" : " " + option.getPlaceholder();
		str.append(value);
		if (option.getShortAlias() != null)
			str.append(", -").append(option.getShortAlias().charValue()).append(value);
		return str.toString();
	}

	private String describe(FieldDescriptor<?> field) {
		StringBuilder str = new StringBuilder();
		if (field.getHelp() != null)
			str.append(field.getHelp());
		String def = field.printDefault();
		if (def != null) {
			if (str.length() > 0)
				str.append(' ');
			str.append("[default: ").append(def).append(']');
		}
		String env = theSettings.getEnvName(field.getEnvVar());
		if (env != null) {
			if (str.length() > 0)
				str.append(' ');
			str.append("[env: ").append(env).append(']');
		}
		return str.toString();
	}

	private static int longest(List<String[]> entries) {
		int longest = 0;
		for (String[] entry : entries)
			longest = Math.max(longest, entry[0].length());
		return longest;
	}

	private static void appendEntries(StringBuilder str, List<String[]> entries, int column) {
		for (String[] entry : entries) {
			String left = INDENT + entry[0];
			str.append(left);
			String help = entry[1];
			if (!Strings.isNullOrEmpty(help)) {
				if (left.length() + GAP.length() <= column)
					str.append(Strings.repeat(" ", column - left.length()));
				else
					str.append('\n').append(Strings.repeat(" ", column));
				str.append(help);
			}
			str.append('\n');
		}
	}
}
