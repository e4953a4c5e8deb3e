package org.qarg.shape;

import com.google.common.base.CaseFormat;

/** Derives command-line names from field names */
class Names {
	private Names() {}

	/**
	 * Converts a camel-case field name to its long option name, e.g. "setUpstream" to "set-upstream". Runs of capitals are kept together
	 * as one word ("HTTPPort" to "http-port", "IDs" to "ids"). Names that are already lower-case are returned as-is.
	 *
	 * @param fieldName The name of the field
	 * @return The long option name
	 */
	static String toLongName(String fieldName) {
		StringBuilder str = new StringBuilder(fieldName.length() + 4);
		int len = fieldName.length();
		for (int i = 0; i < len; i++) {
			char c = fieldName.charAt(i);
			if (Character.isUpperCase(c)) {
				if (i > 0 && str.length() > 0 && str.charAt(str.length() - 1) != '-') {
					char prev = fieldName.charAt(i - 1);
					boolean boundary;
					if (Character.isLowerCase(prev) || Character.isDigit(prev))
						boundary = true;
					else if (Character.isUpperCase(prev) && i + 1 < len && Character.isLowerCase(fieldName.charAt(i + 1)))
						boundary = !(fieldName.charAt(i + 1) == 's' && i + 2 == len); // Plural acronym, e.g. "IDs"
					else
						boundary = false;
					if (boundary)
						str.append('-');
				}
				str.append(Character.toLowerCase(c));
			} else if (c == '_')
				str.append('-');
			else
				str.append(c);
		}
		return str.toString();
	}

	/**
	 * @param longName The long name of an option or positional argument
	 * @return The upper-underscore form of the name, e.g. "set-upstream" to "SET_UPSTREAM", used for placeholders and environment names
	 */
	static String toConstantName(String longName) {
		return CaseFormat.LOWER_HYPHEN.to(CaseFormat.UPPER_UNDERSCORE, longName);
	}
}
