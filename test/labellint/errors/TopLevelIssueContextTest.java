package labellint.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.FileNotFoundException;
import java.nio.file.Paths;

import org.junit.Test;

import labellint.parser.SourceKittenParseException;

public class TopLevelIssueContextTest {

	@Test
	public void empty() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 0 issue(s):"));
	}

	@Test
	public void formatsEveryIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new OptionParserIssue("expected exactly one input file, found 0"));
		ctx.error(new ConfigurationIssue(Paths.get("labellint.json"), "unused_control_flow_label: unknown severity \"fatal\""));
		ctx.error(new SourceKittenParsingIssue(Paths.get("a.swift.syntax.json"),
				new SourceKittenParseException("malformed syntax map: oops")));
		ctx.error(new IOErrorIssue(new FileNotFoundException("a.swift")));
		assertTrue(ctx.hasErrors());

		String nl = System.lineSeparator();
		assertThat(ctx.format(), is("Detected 4 issue(s):" + nl +
				"unable to parse options: expected exactly one input file, found 0" + nl +
				"invalid configuration in labellint.json: unused_control_flow_label: unknown severity \"fatal\"" + nl +
				"error parsing SourceKitten output a.swift.syntax.json: malformed syntax map: oops" + nl +
				"IO Error: java.io.FileNotFoundException: a.swift"));
	}

	@Test
	public void issueMessage() {
		Issue issue = new OptionParserIssue("-q and -v cannot be used together");
		assertThat(issue.getMessage(), is("unable to parse options: -q and -v cannot be used together"));
	}
}
