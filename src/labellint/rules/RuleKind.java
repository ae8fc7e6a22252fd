package labellint.rules;

public enum RuleKind {
	LINT,
	IDIOMATIC,
	STYLE,
	METRICS,
	PERFORMANCE,
}
