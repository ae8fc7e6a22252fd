package labellint.parser;

import labellint.lexer.SyntaxKind;
import labellint.lexer.SyntaxMap;
import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.model.StructureNode;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the JSON printed by {@code sourcekitten structure} and {@code sourcekitten syntax}.
 */
public class SourceKittenReader {
	private static final Logger logger = Logger.getLogger(SourceKittenReader.class.getName());

	static final String KEY_KIND = "key.kind";
	static final String KEY_OFFSET = "key.offset";
	static final String KEY_LENGTH = "key.length";
	static final String KEY_SUBSTRUCTURE = "key.substructure";

	private SourceKittenReader() {}

	public static SourceFile readSourceFile(Path source, Path structure, Path syntax)
			throws IOException, SourceKittenParseException {
		String contents = FileUtils.readFileToString(source.toFile(), StandardCharsets.UTF_8);
		StructureNode root = readStructureFile(structure);
		SyntaxMap syntaxMap = readSyntaxMapFile(syntax);
		logger.fine("Read " + syntaxMap.getTokens().size() + " tokens for " + source);
		return new SourceFile(source, contents, root, syntaxMap);
	}

	public static StructureNode readStructureFile(Path structure) throws IOException, SourceKittenParseException {
		return readStructure(FileUtils.readFileToString(structure.toFile(), StandardCharsets.UTF_8));
	}

	public static SyntaxMap readSyntaxMapFile(Path syntax) throws IOException, SourceKittenParseException {
		return readSyntaxMap(FileUtils.readFileToString(syntax.toFile(), StandardCharsets.UTF_8));
	}

	public static StructureNode readStructure(String json) throws SourceKittenParseException {
		try {
			return readNode(new JSONObject(json));
		} catch (JSONException e) {
			throw new SourceKittenParseException("malformed structure: " + e.getMessage(), e);
		}
	}

	static StructureNode readNode(JSONObject object) {
		String kind = object.optString(KEY_KIND, null);
		int offset = object.optInt(KEY_OFFSET, -1);
		int length = object.optInt(KEY_LENGTH, -1);
		List<StructureNode> substructure = new ArrayList<>();
		JSONArray children = object.optJSONArray(KEY_SUBSTRUCTURE);
		if (children != null) {
			for (int i = 0; i < children.length(); i++) {
				substructure.add(readNode(children.getJSONObject(i)));
			}
		}
		return new StructureNode(kind, offset, length, substructure);
	}

	public static SyntaxMap readSyntaxMap(String json) throws SourceKittenParseException {
		try {
			JSONArray array = new JSONArray(json);
			List<SyntaxToken> tokens = new ArrayList<>(array.length());
			for (int i = 0; i < array.length(); i++) {
				JSONObject token = array.getJSONObject(i);
				tokens.add(new SyntaxToken(
						SyntaxKind.fromIdentifier(token.getString("type")),
						token.getInt("offset"),
						token.getInt("length")));
			}
			return new SyntaxMap(tokens);
		} catch (JSONException e) {
			throw new SourceKittenParseException("malformed syntax map: " + e.getMessage(), e);
		}
	}
}
