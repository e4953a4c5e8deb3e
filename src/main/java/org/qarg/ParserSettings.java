package org.qarg;

/** Program-wide settings of an {@link ArgParser} that are not part of any command's shape */
public final class ParserSettings {
	/** The long name of the implicit flag printing the program's version */
	public static final String VERSION_NAME = "version";
	/** The default column at which help text is aligned */
	public static final int DEFAULT_HELP_COLUMN = 25;
	/** The exit status of a program whose command line could not be parsed */
	public static final int USAGE_ERROR_STATUS = 2;

	private final String theVersion;
	private final int theHelpColumn;
	private final boolean isHelpColumnFitted;
	private final String theEnvPrefix;

	/**
	 * @param version The program version printed for "--version", or null if the program has no version flag
	 * @param helpColumn The column at which help text is aligned, or the maximum column if fitted
	 * @param fitHelpColumn Whether help text is aligned just past the longest entry of each help listing, up to the help column
	 * @param envPrefix The prefix prepended to every declared environment variable name, or null
	 */
	public ParserSettings(String version, int helpColumn, boolean fitHelpColumn, String envPrefix) {
		if (helpColumn < 4)
			throw new IllegalArgumentException("Help column must be at least 4: " + helpColumn);
		theVersion = version;
		theHelpColumn = helpColumn;
		isHelpColumnFitted = fitHelpColumn;
		theEnvPrefix = envPrefix;
	}

	/** @return The program version printed for "--version", or null if the program has no version flag */
	public String getVersion() {
		return theVersion;
	}

	/** @return The long name of the version flag, or null if the program has none */
	public String getVersionName() {
		return theVersion == null ? null : VERSION_NAME;
	}

	/** @return The column at which help text is aligned, or the maximum column if {@link #isHelpColumnFitted() fitted} */
	public int getHelpColumn() {
		return theHelpColumn;
	}

	/** @return Whether help text is aligned just past the longest entry of each help listing, up to the help column */
	public boolean isHelpColumnFitted() {
		return isHelpColumnFitted;
	}

	/**
	 * @param declared The environment variable name declared on a field, or null
	 * @return The name of the variable actually consulted, or null
	 */
	public String getEnvName(String declared) {
		if (declared == null || theEnvPrefix == null)
			return declared;
		return theEnvPrefix + declared;
	}
}
