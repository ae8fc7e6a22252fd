package labellint;

import labellint.model.SourceFile;
import labellint.rules.CorrectableRule;
import labellint.rules.Correction;
import labellint.rules.Rule;
import labellint.rules.StyleViolation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a set of rules over one file, honouring the file's disable commands.
 */
public class Linter {
	private final SourceFile file;
	private final List<Rule> rules;

	public Linter(SourceFile file, List<Rule> rules) {
		this.file = file;
		this.rules = rules;
	}

	public SourceFile getFile() {
		return file;
	}

	public List<StyleViolation> lint() {
		List<StyleViolation> violations = new ArrayList<>();
		for (Rule rule : rules) {
			for (StyleViolation violation : rule.validate(file)) {
				if (file.isRuleEnabled(rule.getDescription().getIdentifier(),
						violation.getLocation().getCharacterOffset())) {
					violations.add(violation);
				}
			}
		}
		violations.sort(Comparator.comparing(StyleViolation::getLocation));
		return violations;
	}

	public List<Correction> correct() throws IOException {
		List<Correction> corrections = new ArrayList<>();
		for (Rule rule : rules) {
			if (rule instanceof CorrectableRule) {
				corrections.addAll(((CorrectableRule) rule).correct(file));
			}
		}
		return corrections;
	}
}
