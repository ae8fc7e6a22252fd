package labellint.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import labellint.Fixtures;
import labellint.lexer.SyntaxMap;

public class SourceFileTest {

	private Path tempDir;

	@Before
	public void setUp() throws Exception {
		tempDir = Files.createTempDirectory("labellinttest");
	}

	@After
	public void tearDown() throws Exception {
		FileUtils.deleteDirectory(tempDir.toFile());
	}

	@Test
	public void writeInvalidatesStructure() throws Exception {
		SourceFile file = Fixtures.load("triggering_while_break");
		assertFalse(file.isStale());
		assertFalse(file.getSyntaxMap().isEmpty());

		file.write("while true { break }");
		assertTrue(file.isStale());
		assertThat(file.getContents(), is("while true { break }"));
		assertThat(file.getStructure(), is(StructureNode.emptyRoot()));
		assertTrue(file.getSyntaxMap().isEmpty());
		assertThat(file.getBridge().getContents(), is("while true { break }"));
	}

	@Test
	public void writeGoesToDisk() throws Exception {
		Path path = tempDir.resolve("a.swift");
		SourceFile file = new SourceFile(path, "", StructureNode.emptyRoot(), SyntaxMap.empty());
		file.write("let ü = 1\n");
		assertThat(FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8), is("let ü = 1\n"));
	}

	@Test
	public void locations() throws Exception {
		SourceFile file = Fixtures.load("multibyte");
		assertThat(file.locationOf(22).getLine(), is(2));
		assertThat(file.locationOf(22).prettyString(), is("<memory>:2:1"));
	}

	@Test
	public void disableCommandsFollowContents() throws Exception {
		SourceFile file = Fixtures.load("suppressed_next_line");
		assertFalse(file.isRuleEnabled("unused_control_flow_label", 52));

		// the comment is gone along with the old syntax map
		file.write(file.getContents());
		assertTrue(file.isRuleEnabled("unused_control_flow_label", 52));

		SourceFile reparsed = Fixtures.load("suppressed_next_line");
		file.refresh(reparsed.getStructure(), reparsed.getSyntaxMap());
		assertFalse(file.isStale());
		assertFalse(file.isRuleEnabled("unused_control_flow_label", 52));
	}
}
