package labellint.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity and documentation of a rule, including example inputs that must not trigger it,
 * inputs that must (with the expected violation marked by {@link #VIOLATION_MARKER}), and
 * input/output pairs for its corrections.
 */
public class RuleDescription {
	public static final String VIOLATION_MARKER = "↓";

	private final String identifier;
	private final String name;
	private final String description;
	private final RuleKind kind;
	private final List<String> nonTriggeringExamples;
	private final List<String> triggeringExamples;
	private final Map<String, String> corrections;

	public RuleDescription(String identifier, String name, String description, RuleKind kind,
			List<String> nonTriggeringExamples, List<String> triggeringExamples,
			Map<String, String> corrections) {
		this.identifier = identifier;
		this.name = name;
		this.description = description;
		this.kind = kind;
		this.nonTriggeringExamples = Collections.unmodifiableList(nonTriggeringExamples);
		this.triggeringExamples = Collections.unmodifiableList(triggeringExamples);
		this.corrections = Collections.unmodifiableMap(new LinkedHashMap<>(corrections));
	}

	public String getIdentifier() {
		return identifier;
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	public RuleKind getKind() {
		return kind;
	}

	public List<String> getNonTriggeringExamples() {
		return nonTriggeringExamples;
	}

	public List<String> getTriggeringExamples() {
		return triggeringExamples;
	}

	public Map<String, String> getCorrections() {
		return corrections;
	}

	@Override
	public String toString() {
		return "RuleDescription [identifier=" + identifier + "]";
	}
}
