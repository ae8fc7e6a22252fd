package labellint.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(SourceKittenParsingIssue sourceKittenParsingIssue) throws E;
	public abstract T visit(ConfigurationIssue configurationIssue) throws E;
}
