package labellint.formatters;

import labellint.errors.ConfigurationIssue;
import labellint.errors.IOErrorIssue;
import labellint.errors.IssueVisitor;
import labellint.errors.OptionParserIssue;
import labellint.errors.SourceKittenParsingIssue;

import java.io.IOException;
import java.io.Writer;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final Writer out;

	public IssueFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(SourceKittenParsingIssue sourceKittenParsingIssue) throws IOException {
		out.write("error parsing SourceKitten output ");
		out.write(String.valueOf(sourceKittenParsingIssue.getFile()));
		out.write(": ");
		out.write(sourceKittenParsingIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(ConfigurationIssue configurationIssue) throws IOException {
		out.write("invalid configuration in ");
		out.write(String.valueOf(configurationIssue.getFile()));
		out.write(": ");
		out.write(configurationIssue.getReason());
		return null;
	}
}
