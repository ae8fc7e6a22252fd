package labellint.rules.lint;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import labellint.Fixtures;
import labellint.lexer.SyntaxKind;
import labellint.lexer.SyntaxMap;
import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.model.StatementKind;
import labellint.model.StructureNode;
import labellint.util.ByteRange;
import labellint.util.TextRange;

public class LabelDetectorTest {

	private static StructureNode firstStatement(SourceFile file) {
		return file.getStructure().getSubstructure().get(0);
	}

	private static LabelCandidate detectFirst(String fixture) throws Exception {
		SourceFile file = Fixtures.load(fixture);
		StructureNode node = firstStatement(file);
		return LabelDetector.detect(file, node.getStatementKind(), node);
	}

	@Test
	public void labeledWhile() throws Exception {
		LabelCandidate label = detectFirst("triggering_while_break");
		assertThat(label.getName(), is("loop"));
		assertThat(label.getCharacterRange(), is(new TextRange(0, 4)));
		assertThat(label.getByteRange(), is(new ByteRange(0, 4)));
	}

	@Test
	public void labelOnItsOwnLine() throws Exception {
		assertThat(detectFirst("nontriggering_label_on_own_line").getName(), is("loop"));
	}

	@Test
	public void everyLabelableKind() throws Exception {
		assertThat(detectFirst("triggering_if").getName(), is("check"));
		assertThat(detectFirst("triggering_for").getName(), is("loop"));
		assertThat(detectFirst("triggering_foreach").getName(), is("loop"));
		assertThat(detectFirst("triggering_repeat").getName(), is("loop"));
		assertThat(detectFirst("triggering_switch").getName(), is("label"));
	}

	@Test
	public void unlabeledStatement() throws Exception {
		assertThat(detectFirst("nontriggering_unlabeled_while"), is(nullValue()));
	}

	@Test
	public void guardIsNotLabelable() throws Exception {
		SourceFile file = Fixtures.load("guard_labelled_block");
		StructureNode guard = firstStatement(file);
		assertThat(guard.getStatementKind(), is(StatementKind.GUARD));
		assertThat(LabelDetector.detect(file, StatementKind.GUARD, guard), is(nullValue()));
		// the same node seen as a while would be unlabeled as well, its first token is a keyword
		assertThat(LabelDetector.detect(file, StatementKind.WHILE, guard), is(nullValue()));
	}

	@Test
	public void braceIsNotLabelable() throws Exception {
		SourceFile file = Fixtures.load("triggering_while_break");
		StructureNode brace = firstStatement(file).getSubstructure().get(0);
		assertThat(brace.getStatementKind(), is(StatementKind.BRACE));
		assertThat(LabelDetector.detect(file, StatementKind.BRACE, brace), is(nullValue()));
	}

	@Test
	public void multibyteLabelLocation() throws Exception {
		SourceFile file = Fixtures.load("multibyte");
		StructureNode loop = firstStatement(file);
		LabelCandidate label = LabelDetector.detect(file, loop.getStatementKind(), loop);
		assertThat(label.getName(), is("loop"));
		assertThat(label.getByteRange(), is(new ByteRange(26, 4)));
		assertThat(label.getCharacterRange(), is(new TextRange(22, 4)));
	}

	@Test
	public void missingRange() throws Exception {
		SourceFile file = Fixtures.load("triggering_while_break");
		StructureNode node = new StructureNode(StatementKind.WHILE.getIdentifier(), -1, -1, Collections.emptyList());
		assertThat(LabelDetector.detect(file, StatementKind.WHILE, node), is(nullValue()));
	}

	@Test
	public void noTokens() {
		StructureNode node = new StructureNode(StatementKind.WHILE.getIdentifier(), 0, 19, Collections.emptyList());
		SourceFile file = SourceFile.inMemory("loop: while true {}", StructureNode.emptyRoot(), SyntaxMap.empty());
		assertThat(LabelDetector.detect(file, StatementKind.WHILE, node), is(nullValue()));
	}

	@Test
	public void labelOffCharacterBoundary() {
		// the identifier token claims to start inside the two bytes of é
		String contents = "é: while true {}";
		SyntaxMap tokens = new SyntaxMap(Arrays.asList(
				new SyntaxToken(SyntaxKind.IDENTIFIER, 1, 1),
				new SyntaxToken(SyntaxKind.KEYWORD, 4, 5)));
		StructureNode node = new StructureNode(StatementKind.WHILE.getIdentifier(), 1, 16, Collections.emptyList());
		SourceFile file = SourceFile.inMemory(contents, StructureNode.emptyRoot(), tokens);
		assertThat(LabelDetector.detect(file, StatementKind.WHILE, node), is(nullValue()));
	}
}
