package labellint.rules;

import labellint.model.SourceFile;

import java.util.List;

public interface Rule {

	RuleDescription getDescription();

	SeverityConfiguration getConfiguration();

	List<StyleViolation> validate(SourceFile file);

}
