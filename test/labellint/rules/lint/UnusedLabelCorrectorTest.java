package labellint.rules.lint;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import labellint.Fixtures;
import labellint.lexer.SyntaxKind;
import labellint.lexer.SyntaxMap;
import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.model.StructureNode;
import labellint.util.TextRange;

public class UnusedLabelCorrectorTest {

	private static SourceFile tokenized(String contents, SyntaxToken... tokens) {
		return SourceFile.inMemory(contents, StructureNode.emptyRoot(), new SyntaxMap(Arrays.asList(tokens)));
	}

	@Test
	public void removeRanges() {
		assertThat(UnusedLabelCorrector.removeRanges("abcdef",
				Arrays.asList(new TextRange(4, 1), new TextRange(0, 2))), is("cdf"));
		assertThat(UnusedLabelCorrector.removeRanges("abcdef",
				Arrays.asList(new TextRange(1, 3), new TextRange(2, 3))), is("af"));
		assertThat(UnusedLabelCorrector.removeRanges("abcdef",
				Collections.singletonList(new TextRange(0, 6))), is(""));
		assertThat(UnusedLabelCorrector.removeRanges("abcdef", Collections.<TextRange>emptyList()), is("abcdef"));
	}

	@Test
	public void removalRunsToNextToken() throws Exception {
		SourceFile file = Fixtures.load("triggering_while_break");
		assertThat(UnusedLabelCorrector.removalRange(file, new TextRange(0, 4)), is(new TextRange(0, 6)));

		SourceFile ownLine = Fixtures.load("nontriggering_label_on_own_line");
		assertThat(UnusedLabelCorrector.removalRange(ownLine, new TextRange(0, 4)), is(new TextRange(0, 10)));
	}

	@Test
	public void removalWithoutFollowingToken() {
		SourceFile withColon = tokenized("loop :  \n", new SyntaxToken(SyntaxKind.IDENTIFIER, 0, 4));
		assertThat(UnusedLabelCorrector.removalRange(withColon, new TextRange(0, 4)), is(new TextRange(0, 9)));

		SourceFile withoutColon = tokenized("loop   x", new SyntaxToken(SyntaxKind.IDENTIFIER, 0, 4));
		assertThat(UnusedLabelCorrector.removalRange(withoutColon, new TextRange(0, 4)), is(new TextRange(0, 4)));
	}

	@Test
	public void separatorEnd() {
		assertThat(UnusedLabelCorrector.separatorEnd("a: b", 1), is(3));
		assertThat(UnusedLabelCorrector.separatorEnd("a :\n\tb", 1), is(5));
		assertThat(UnusedLabelCorrector.separatorEnd("a b", 1), is(1));
		assertThat(UnusedLabelCorrector.separatorEnd("a", 1), is(1));
	}

	@Test
	public void rangesOutsideTheTextAreSkipped() throws Exception {
		SourceFile file = Fixtures.load("triggering_while_break");
		UnusedLabelCorrector.Result result = UnusedLabelCorrector.correct(file,
				Arrays.asList(new TextRange(100, 4), new TextRange(0, 4)));
		assertThat(result.getAppliedRanges(), is(Collections.singletonList(new TextRange(0, 4))));
		assertThat(result.getContents(), is("while true { break }"));
	}

	@Test
	public void singlePassMatchesBackToFrontEdits() throws Exception {
		for (String fixture : Arrays.asList("nested_both_unused", "nested_inner_unused", "multibyte", "triggering_repeat")) {
			SourceFile file = Fixtures.load(fixture);
			List<TextRange> ranges = UnusedLabelCollector.collect(file);

			String expected = file.getContents();
			for (TextRange range : ranges) {
				TextRange removal = UnusedLabelCorrector.removalRange(file, range);
				expected = expected.substring(0, removal.getLocation()) + expected.substring(removal.getEnd());
			}

			UnusedLabelCorrector.Result result = UnusedLabelCorrector.correct(file, ranges);
			assertThat(fixture, result.getContents(), is(expected));
			assertThat(result.getAppliedRanges(), is(ranges));
		}
	}

	@Test
	public void nestedLabels() throws Exception {
		SourceFile file = Fixtures.load("nested_both_unused");
		UnusedLabelCorrector.Result result = UnusedLabelCorrector.correct(file, UnusedLabelCollector.collect(file));
		assertThat(result.getContents(), is("while true {\n    while false { break }\n    break\n}"));
	}
}
