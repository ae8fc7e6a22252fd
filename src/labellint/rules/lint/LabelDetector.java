package labellint.rules.lint;

import labellint.lexer.SyntaxKind;
import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.model.StatementKind;
import labellint.model.StructureNode;
import labellint.util.ByteRange;
import labellint.util.TextRange;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Finds the label in front of a control flow statement. SourceKit starts a labeled statement's
 * range at the label, so the label is the statement's first token whenever that token is an
 * identifier.
 */
public class LabelDetector {
	private static final Logger logger = Logger.getLogger(LabelDetector.class.getName());

	public static final Set<StatementKind> LABELABLE_KINDS = Collections.unmodifiableSet(EnumSet.of(
			StatementKind.IF,
			StatementKind.FOR,
			StatementKind.FOR_EACH,
			StatementKind.WHILE,
			StatementKind.REPEAT_WHILE,
			StatementKind.SWITCH));

	private LabelDetector() {}

	/**
	 * @return the statement's label, or null if it has none
	 */
	public static LabelCandidate detect(SourceFile file, StatementKind kind, StructureNode node) {
		if (!LABELABLE_KINDS.contains(kind)) {
			return null;
		}
		ByteRange statementRange = node.getByteRange();
		if (statementRange == null) {
			logger.fine("Skipping " + kind + " statement without offset or length");
			return null;
		}
		List<SyntaxToken> tokens = file.getSyntaxMap().tokensInByteRange(statementRange);
		if (tokens.isEmpty()) {
			return null;
		}
		SyntaxToken first = tokens.get(0);
		if (first.getType() != SyntaxKind.IDENTIFIER) {
			return null;
		}
		TextRange characterRange = file.getBridge().byteRangeToTextRange(first.getByteRange());
		if (characterRange == null) {
			logger.fine("Skipping label at byte " + first.getOffset() + ": not on a character boundary");
			return null;
		}
		String name = file.getContents().substring(characterRange.getLocation(), characterRange.getEnd());
		return new LabelCandidate(name, characterRange, first.getByteRange());
	}
}
