package labellint.rules;

import java.util.Locale;

public enum Severity {
	WARNING,
	ERROR;

	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * @return the severity spelled name (case-insensitively), or null if there is none
	 */
	public static Severity fromName(String name) {
		for (Severity severity : values()) {
			if (severity.getName().equalsIgnoreCase(name)) {
				return severity;
			}
		}
		return null;
	}
}
