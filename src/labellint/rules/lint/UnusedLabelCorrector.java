package labellint.rules.lint;

import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.util.ByteRange;
import labellint.util.OffsetBridge;
import labellint.util.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Removes unused labels, together with the colon and whitespace separating them from their
 * statement, from a file's text.
 *
 * The removals are computed against the original text and applied in a single pass, so the
 * result does not depend on the order the labels are processed in.
 */
public class UnusedLabelCorrector {
	private static final Logger logger = Logger.getLogger(UnusedLabelCorrector.class.getName());

	public static class Result {
		private final String contents;
		private final List<TextRange> appliedRanges;

		public Result(String contents, List<TextRange> appliedRanges) {
			this.contents = contents;
			this.appliedRanges = Collections.unmodifiableList(appliedRanges);
		}

		public String getContents() {
			return contents;
		}

		/**
		 * @return the label ranges that were removed, in the order they were given
		 */
		public List<TextRange> getAppliedRanges() {
			return appliedRanges;
		}
	}

	private UnusedLabelCorrector() {}

	public static Result correct(SourceFile file, List<TextRange> labelRanges) {
		List<TextRange> removals = new ArrayList<>();
		List<TextRange> applied = new ArrayList<>();
		for (TextRange label : labelRanges) {
			TextRange removal = removalRange(file, label);
			if (removal == null) {
				logger.fine("Not removing label at character " + label.getLocation() + ": no byte offset for it");
				continue;
			}
			removals.add(removal);
			applied.add(label);
		}
		return new Result(removeRanges(file.getContents(), removals), applied);
	}

	/**
	 * Extends label up to the token following it. Without such a token the label is extended over
	 * a following colon and the whitespace around it.
	 *
	 * @return the range to delete, or null if label does not map onto bytes
	 */
	static TextRange removalRange(SourceFile file, TextRange label) {
		OffsetBridge bridge = file.getBridge();
		ByteRange byteRange = bridge.textRangeToByteRange(label);
		if (byteRange == null) {
			return null;
		}
		SyntaxToken next = file.getSyntaxMap().firstTokenAfterByteOffset(byteRange.getOffset());
		if (next != null) {
			int nextLocation = bridge.byteOffsetToCharacterOffset(next.getOffset());
			if (nextLocation >= label.getEnd()) {
				return label.withLength(nextLocation - label.getLocation());
			}
		}
		return label.withLength(separatorEnd(file.getContents(), label.getEnd()) - label.getLocation());
	}

	static int separatorEnd(String contents, int from) {
		int pos = skipWhitespace(contents, from);
		if (pos < contents.length() && contents.charAt(pos) == ':') {
			return skipWhitespace(contents, pos + 1);
		}
		return from;
	}

	private static int skipWhitespace(String contents, int from) {
		int pos = from;
		while (pos < contents.length() && Character.isWhitespace(contents.charAt(pos))) {
			pos++;
		}
		return pos;
	}

	/**
	 * Copies original, leaving out every range in removals. Overlapping ranges are merged.
	 */
	static String removeRanges(String original, List<TextRange> removals) {
		List<TextRange> sorted = new ArrayList<>(removals);
		Collections.sort(sorted);
		StringBuilder out = new StringBuilder(original.length());
		int copied = 0;
		for (TextRange removal : sorted) {
			if (removal.getLocation() > copied) {
				out.append(original, copied, removal.getLocation());
			}
			copied = Integer.max(copied, removal.getEnd());
		}
		if (copied < original.length()) {
			out.append(original, copied, original.length());
		}
		return out.toString();
	}
}
