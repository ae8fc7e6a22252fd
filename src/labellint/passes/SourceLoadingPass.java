package labellint.passes;

import labellint.errors.IOErrorIssue;
import labellint.errors.IssueContext;
import labellint.errors.SourceKittenParsingIssue;
import labellint.lexer.SyntaxMap;
import labellint.model.SourceFile;
import labellint.model.StructureNode;
import labellint.parser.SourceKittenParseException;
import labellint.parser.SourceKittenReader;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

public class SourceLoadingPass {
	private static final Logger logger = Logger.getLogger(SourceLoadingPass.class.getName());

	private SourceLoadingPass() {}

	/**
	 * @return the loaded file, or null if an issue was reported to ctx
	 */
	public static SourceFile perform(IssueContext ctx, Path source, Path structure, Path syntax) {
		String contents;
		try {
			contents = FileUtils.readFileToString(source.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return null;
		}
		StructureNode root = null;
		try {
			root = SourceKittenReader.readStructureFile(structure);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		} catch (SourceKittenParseException e) {
			ctx.error(new SourceKittenParsingIssue(structure, e));
		}
		SyntaxMap syntaxMap = null;
		try {
			syntaxMap = SourceKittenReader.readSyntaxMapFile(syntax);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		} catch (SourceKittenParseException e) {
			ctx.error(new SourceKittenParsingIssue(syntax, e));
		}
		if (root == null || syntaxMap == null) {
			return null;
		}
		SourceFile file = new SourceFile(source, contents, root, syntaxMap);
		if (root.hasByteRange() && root.getByteRange().getEndOffset() > file.getBridge().getByteLength()) {
			logger.warning("Structure of " + source + " extends past the end of the file; was it generated for other contents?");
		}
		return file;
	}
}
