package labellint.model;

/**
 * The statement node kinds SourceKit reports in a file's structure.
 */
public enum StatementKind {
	IF("source.lang.swift.stmt.if"),
	GUARD("source.lang.swift.stmt.guard"),
	FOR("source.lang.swift.stmt.for"),
	FOR_EACH("source.lang.swift.stmt.foreach"),
	WHILE("source.lang.swift.stmt.while"),
	REPEAT_WHILE("source.lang.swift.stmt.repeatwhile"),
	BRACE("source.lang.swift.stmt.brace"),
	SWITCH("source.lang.swift.stmt.switch"),
	CASE("source.lang.swift.stmt.case");

	private final String identifier;

	StatementKind(String identifier) {
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}

	/**
	 * @return the matching kind, or null when identifier does not name a statement (declarations,
	 * expressions and so on)
	 */
	public static StatementKind fromIdentifier(String identifier) {
		if (identifier == null) {
			return null;
		}
		for (StatementKind kind : values()) {
			if (kind.identifier.equals(identifier)) {
				return kind;
			}
		}
		return null;
	}
}
