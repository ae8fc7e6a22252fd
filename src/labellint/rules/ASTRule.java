package labellint.rules;

import labellint.model.SourceFile;
import labellint.model.StatementKind;
import labellint.model.StructureNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A rule that is checked once per statement node of a file's structure tree.
 */
public abstract class ASTRule implements Rule {

	public abstract List<StyleViolation> validate(SourceFile file, StatementKind kind, StructureNode node);

	@Override
	public List<StyleViolation> validate(SourceFile file) {
		return validate(file, file.getStructure());
	}

	private List<StyleViolation> validate(SourceFile file, StructureNode parent) {
		List<StyleViolation> result = new ArrayList<>();
		for (StructureNode node : parent.getSubstructure()) {
			result.addAll(validate(file, node));
			StatementKind kind = node.getStatementKind();
			if (kind != null) {
				result.addAll(validate(file, kind, node));
			}
		}
		return result;
	}
}
