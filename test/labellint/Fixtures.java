package labellint;

import labellint.model.SourceFile;
import labellint.parser.SourceKittenParseException;
import labellint.parser.SourceKittenReader;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Swift snippets paired with the SourceKitten structure and syntax output for them, stored
 * under test/fixtures/examples as NAME.swift, NAME.swift.structure.json and NAME.swift.syntax.json.
 */
public class Fixtures {
	public static final Path EXAMPLES = Paths.get("test", "fixtures", "examples");

	private Fixtures() {}

	public static Path source(String name) {
		return EXAMPLES.resolve(name + ".swift");
	}

	public static Path structure(String name) {
		return EXAMPLES.resolve(name + ".swift.structure.json");
	}

	public static Path syntax(String name) {
		return EXAMPLES.resolve(name + ".swift.syntax.json");
	}

	/**
	 * Loads a fixture into memory, so that corrections never write over the fixture itself.
	 */
	public static SourceFile load(String name) throws IOException, SourceKittenParseException {
		SourceFile onDisk = SourceKittenReader.readSourceFile(source(name), structure(name), syntax(name));
		return SourceFile.inMemory(onDisk.getContents(), onDisk.getStructure(), onDisk.getSyntaxMap());
	}

	/**
	 * Finds the fixture whose source text is exactly contents.
	 */
	public static SourceFile loadByContents(String contents) throws IOException, SourceKittenParseException {
		List<Path> sources;
		try (Stream<Path> files = Files.list(EXAMPLES)) {
			sources = files.filter(p -> p.getFileName().toString().endsWith(".swift")).sorted()
					.collect(Collectors.toList());
		}
		for (Path source : sources) {
			if (FileUtils.readFileToString(source.toFile(), StandardCharsets.UTF_8).equals(contents)) {
				String fileName = source.getFileName().toString();
				return load(fileName.substring(0, fileName.length() - ".swift".length()));
			}
		}
		throw new AssertionError("no fixture for source text: " + contents);
	}

	/**
	 * Copies a fixture's three files into dir.
	 *
	 * @return the path of the copied source file
	 */
	public static Path copyTo(String name, File dir) throws IOException {
		FileUtils.copyFileToDirectory(source(name).toFile(), dir);
		FileUtils.copyFileToDirectory(structure(name).toFile(), dir);
		FileUtils.copyFileToDirectory(syntax(name).toFile(), dir);
		return dir.toPath().resolve(name + ".swift");
	}
}
