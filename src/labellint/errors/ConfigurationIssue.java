package labellint.errors;

import java.nio.file.Path;

/**
 * A configuration file that could not be read as labellint configuration.
 */
public class ConfigurationIssue extends Issue {
	private final Path file;
	private final String reason;

	public ConfigurationIssue(Path file, String reason) {
		this.file = file;
		this.reason = reason;
	}

	public Path getFile() {
		return file;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
