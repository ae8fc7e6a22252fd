package labellint.rules;

import org.json.JSONObject;

/**
 * Rule configuration consisting of nothing but a severity. Accepts either a bare severity name
 * or an object with a {@code severity} key.
 */
public class SeverityConfiguration {
	private Severity severity;

	public SeverityConfiguration(Severity severity) {
		this.severity = severity;
	}

	public Severity getSeverity() {
		return severity;
	}

	public void apply(Object configuration) throws InvalidConfigurationException {
		String name;
		if (configuration instanceof String) {
			name = (String) configuration;
		} else if (configuration instanceof JSONObject && ((JSONObject) configuration).has("severity")) {
			name = String.valueOf(((JSONObject) configuration).get("severity"));
		} else {
			throw new InvalidConfigurationException("expected a severity, found " + configuration);
		}
		Severity parsed = Severity.fromName(name);
		if (parsed == null) {
			throw new InvalidConfigurationException("unknown severity \"" + name + "\"");
		}
		severity = parsed;
	}

	@Override
	public String toString() {
		return severity.getName();
	}
}
