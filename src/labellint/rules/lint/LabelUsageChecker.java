package labellint.rules.lint;

import labellint.lexer.SyntaxKind;
import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.util.ByteRange;
import labellint.util.TextRange;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a label is the target of a {@code break} or {@code continue} within a statement.
 *
 * Only keyword and identifier tokens are considered, so jumps spelled out inside strings or
 * comments never count. Matching is by containment: a jump naming the label anywhere inside
 * the statement counts, even when a nested statement redeclares the same label.
 */
public class LabelUsageChecker {

	static final Set<String> JUMP_KEYWORDS = Collections.unmodifiableSet(
			new HashSet<>(Arrays.asList("break", "continue")));

	private LabelUsageChecker() {}

	public static boolean isLabelUsed(SourceFile file, LabelCandidate label, ByteRange statementRange) {
		List<SyntaxToken> tokens = file.getSyntaxMap().tokensInByteRange(statementRange);
		for (int i = 0; i + 1 < tokens.size(); i++) {
			SyntaxToken jump = tokens.get(i);
			SyntaxToken target = tokens.get(i + 1);
			if (jump.getType() != SyntaxKind.KEYWORD || target.getType() != SyntaxKind.IDENTIFIER) {
				continue;
			}
			TextRange jumpRange = file.getBridge().byteRangeToTextRange(jump.getByteRange());
			TextRange targetRange = file.getBridge().byteRangeToTextRange(target.getByteRange());
			if (jumpRange == null || targetRange == null || targetRange.getLocation() <= jumpRange.getEnd()) {
				continue;
			}
			String contents = file.getContents();
			if (JUMP_KEYWORDS.contains(contents.substring(jumpRange.getLocation(), jumpRange.getEnd())) &&
					isWhitespace(contents, jumpRange.getEnd(), targetRange.getLocation()) &&
					label.getName().equals(contents.substring(targetRange.getLocation(), targetRange.getEnd()))) {
				return true;
			}
		}
		return false;
	}

	private static boolean isWhitespace(String contents, int from, int to) {
		for (int pos = from; pos < to; pos++) {
			if (!Character.isWhitespace(contents.charAt(pos))) {
				return false;
			}
		}
		return true;
	}
}
