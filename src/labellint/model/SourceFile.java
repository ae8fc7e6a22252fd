package labellint.model;

import labellint.lexer.SyntaxMap;
import labellint.regions.RuleRegions;
import labellint.util.Location;
import labellint.util.OffsetBridge;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * A Swift source file together with the structure tree and syntax map SourceKit produced for it.
 *
 * Writing new contents invalidates the structure data: until {@link #refresh} supplies data for the
 * new text the file reports itself stale and exposes an empty structure and syntax map.
 */
public class SourceFile {
	private final Path path;
	private String contents;
	private StructureNode structure;
	private SyntaxMap syntaxMap;
	private OffsetBridge bridge;
	private RuleRegions regions;
	private boolean stale;

	public SourceFile(Path path, String contents, StructureNode structure, SyntaxMap syntaxMap) {
		this.path = path;
		this.contents = contents;
		this.structure = structure;
		this.syntaxMap = syntaxMap;
		this.bridge = new OffsetBridge(contents);
		this.stale = false;
	}

	public static SourceFile inMemory(String contents, StructureNode structure, SyntaxMap syntaxMap) {
		return new SourceFile(null, contents, structure, syntaxMap);
	}

	public Path getPath() {
		return path;
	}

	public String getContents() {
		return contents;
	}

	public StructureNode getStructure() {
		return structure;
	}

	public SyntaxMap getSyntaxMap() {
		return syntaxMap;
	}

	public OffsetBridge getBridge() {
		return bridge;
	}

	public boolean isStale() {
		return stale;
	}

	public Location locationOf(int characterOffset) {
		return Location.of(path, contents, characterOffset);
	}

	public boolean isRuleEnabled(String ruleIdentifier, int characterOffset) {
		if (regions == null) {
			regions = RuleRegions.of(this);
		}
		return regions.isRuleEnabled(ruleIdentifier, characterOffset);
	}

	/**
	 * Replaces the contents, writing them to disk when the file is backed by a path.
	 */
	public void write(String newContents) throws IOException {
		if (path != null) {
			FileUtils.writeStringToFile(path.toFile(), newContents, StandardCharsets.UTF_8);
		}
		contents = newContents;
		bridge = new OffsetBridge(newContents);
		structure = StructureNode.emptyRoot();
		syntaxMap = SyntaxMap.empty();
		regions = null;
		stale = true;
	}

	public void refresh(StructureNode newStructure, SyntaxMap newSyntaxMap) {
		structure = newStructure;
		syntaxMap = newSyntaxMap;
		regions = null;
		stale = false;
	}

	@Override
	public String toString() {
		return "SourceFile [path=" + path + ", stale=" + stale + "]";
	}
}
