package labellint.lexer;

/**
 * Token classifications as reported by SourceKit's syntax map. Punctuation and operators
 * are never classified, so they do not appear as tokens at all.
 */
public enum SyntaxKind {
	KEYWORD("source.lang.swift.syntaxtype.keyword"),
	IDENTIFIER("source.lang.swift.syntaxtype.identifier"),
	TYPEIDENTIFIER("source.lang.swift.syntaxtype.typeidentifier"),
	STRING("source.lang.swift.syntaxtype.string"),
	STRING_INTERPOLATION_ANCHOR("source.lang.swift.syntaxtype.string_interpolation_anchor"),
	NUMBER("source.lang.swift.syntaxtype.number"),
	COMMENT("source.lang.swift.syntaxtype.comment"),
	COMMENT_MARK("source.lang.swift.syntaxtype.comment.mark"),
	COMMENT_URL("source.lang.swift.syntaxtype.comment.url"),
	DOC_COMMENT("source.lang.swift.syntaxtype.doccomment"),
	DOC_COMMENT_FIELD("source.lang.swift.syntaxtype.doccomment.field"),
	ATTRIBUTE_BUILTIN("source.lang.swift.syntaxtype.attribute.builtin"),
	ATTRIBUTE_ID("source.lang.swift.syntaxtype.attribute.id"),
	BUILDCONFIG_KEYWORD("source.lang.swift.syntaxtype.buildconfig.keyword"),
	BUILDCONFIG_ID("source.lang.swift.syntaxtype.buildconfig.id"),
	POUND_DIRECTIVE_KEYWORD("source.lang.swift.syntaxtype.pounddirective.keyword"),
	OBJECT_LITERAL("source.lang.swift.syntaxtype.objectliteral"),
	PLACEHOLDER("source.lang.swift.syntaxtype.placeholder"),
	// anything SourceKit reports that we don't know about
	OTHER(null);

	private final String identifier;

	SyntaxKind(String identifier) {
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}

	public boolean isComment() {
		return this == COMMENT || this == COMMENT_MARK || this == COMMENT_URL || this == DOC_COMMENT ||
				this == DOC_COMMENT_FIELD;
	}

	public static SyntaxKind fromIdentifier(String identifier) {
		for (SyntaxKind kind : values()) {
			if (kind.identifier != null && kind.identifier.equals(identifier)) {
				return kind;
			}
		}
		return OTHER;
	}
}
