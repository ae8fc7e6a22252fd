package labellint.rules.lint;

import labellint.model.SourceFile;
import labellint.model.StatementKind;
import labellint.model.StructureNode;
import labellint.util.ByteRange;
import labellint.util.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * Walks a file's structure and collects the character ranges of labels nothing jumps to.
 */
public class UnusedLabelCollector {
	private static final Logger logger = Logger.getLogger(UnusedLabelCollector.class.getName());

	private UnusedLabelCollector() {}

	/**
	 * @return the range of node's label if the label is unused, null otherwise
	 */
	public static TextRange violationRange(SourceFile file, StatementKind kind, StructureNode node) {
		LabelCandidate label = LabelDetector.detect(file, kind, node);
		if (label == null) {
			return null;
		}
		ByteRange statementRange = node.getByteRange();
		if (file.getBridge().byteRangeToTextRange(statementRange) == null) {
			logger.fine("Skipping statement at byte " + statementRange.getOffset() + ": range is not on character boundaries");
			return null;
		}
		if (LabelUsageChecker.isLabelUsed(file, label, statementRange)) {
			return null;
		}
		return label.getCharacterRange();
	}

	/**
	 * @return every unused label range in the file without duplicates, last in the file first
	 */
	public static List<TextRange> collect(SourceFile file) {
		List<TextRange> ranges = new ArrayList<>(new LinkedHashSet<>(collect(file, file.getStructure())));
		ranges.sort(Collections.reverseOrder());
		return ranges;
	}

	static List<TextRange> collect(SourceFile file, StructureNode parent) {
		List<TextRange> result = new ArrayList<>();
		for (StructureNode node : parent.getSubstructure()) {
			result.addAll(collect(file, node));
			StatementKind kind = node.getStatementKind();
			if (kind != null) {
				TextRange range = violationRange(file, kind, node);
				if (range != null) {
					result.add(range);
				}
			}
		}
		return result;
	}
}
