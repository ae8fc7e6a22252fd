package labellint.errors;

import labellint.LabelLintException;
import labellint.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public abstract class Issue extends LabelLintException {
	public Issue() {
		super("", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(sw));
		} catch (IOException e) {
			// StringWriter does not throw
			throw new UncheckedIOException(e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
