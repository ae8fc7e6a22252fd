package labellint.rules;

import labellint.model.SourceFile;

import java.io.IOException;
import java.util.List;

public interface CorrectableRule extends Rule {

	/**
	 * Rewrites file to fix every enabled violation of this rule. When nothing needs fixing the
	 * file is left untouched and the result is empty.
	 */
	List<Correction> correct(SourceFile file) throws IOException;

}
