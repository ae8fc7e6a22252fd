package labellint.formatters;

import labellint.rules.Correction;
import labellint.rules.StyleViolation;

/**
 * Formats results the way Xcode expects compiler diagnostics, so they show up inline.
 */
public class ReportFormatter {

	private ReportFormatter() {}

	public static String format(StyleViolation violation) {
		return violation.getLocation().prettyString() + ": " +
				violation.getSeverity().getName() + ": " +
				violation.getRuleDescription().getName() + " Violation: " +
				violation.getReason() + " (" + violation.getRuleDescription().getIdentifier() + ")";
	}

	public static String format(Correction correction) {
		return correction.getLocation().prettyString() + " Corrected " + correction.getDescription();
	}
}
