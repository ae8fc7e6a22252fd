package labellint.errors;

public class OptionParserIssue extends Issue {
	private final String reason;

	public OptionParserIssue(String reason) {
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
