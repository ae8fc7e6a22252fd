package labellint.errors;

import labellint.parser.SourceKittenParseException;

import java.nio.file.Path;

public class SourceKittenParsingIssue extends Issue {
	private final Path file;
	private final SourceKittenParseException error;

	public SourceKittenParsingIssue(Path file, SourceKittenParseException error) {
		initCause(error);
		this.file = file;
		this.error = error;
	}

	public Path getFile() {
		return file;
	}

	public SourceKittenParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
