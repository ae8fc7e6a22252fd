package labellint.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A user-facing position in a source file: 1-based line and column, both counted in characters.
 */
public class Location implements Comparable<Location> {
	private final Path file;
	private final int characterOffset;
	private final int line;
	private final int column;

	public Location(Path file, int characterOffset, int line, int column) {
		this.file = file;
		this.characterOffset = characterOffset;
		this.line = line;
		this.column = column;
	}

	/**
	 * Computes the line and column of characterOffset within contents. Offsets past the end of
	 * the text are clamped to the end.
	 */
	public static Location of(Path file, String contents, int characterOffset) {
		int offset = Integer.min(Integer.max(characterOffset, 0), contents.length());
		int line = 1;
		int lineStart = 0;
		for (int pos = 0; pos < offset; pos++) {
			if (contents.charAt(pos) == '\n') {
				line++;
				lineStart = pos + 1;
			}
		}
		return new Location(file, offset, line, offset - lineStart + 1);
	}

	public static Location unknown() {
		return new Location(null, -1, -1, -1);
	}

	public boolean isUnknown() {
		return line == -1;
	}

	public Path getFile() {
		return file;
	}

	public int getCharacterOffset() {
		return characterOffset;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "<unknown>";
		}
		return (file == null ? "<memory>" : file.toString()) + ":" + line + ":" + column;
	}

	/**
	 * Renders the source line this location points into, with a caret underneath the column.
	 */
	public String excerpt(String contents) {
		if (isUnknown() || characterOffset > contents.length()) {
			return "";
		}
		int lineStart = characterOffset;
		while (lineStart > 0 && contents.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = characterOffset;
		while (lineEnd < contents.length() && contents.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		StringBuilder out = new StringBuilder();
		out.append(contents, lineStart, lineEnd);
		out.append('\n');
		for (int pos = lineStart; pos < characterOffset; pos++) {
			out.append(contents.charAt(pos) == '\t' ? '\t' : ' ');
		}
		out.append('^');
		if (characterOffset == contents.length()) {
			out.append(" EOF");
		}
		return out.toString();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((file == null) ? 0 : file.hashCode());
		result = prime * result + characterOffset;
		result = prime * result + line;
		result = prime * result + column;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		Location other = (Location) obj;
		return characterOffset == other.characterOffset && line == other.line && column == other.column &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "Location [UNKNOWN]";
		}
		return "Location [file=" + file + ", characterOffset=" + characterOffset + ", line=" + line +
				", column=" + column + "]";
	}

	@Override
	public int compareTo(Location o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		if (file != null && o.file != null) {
			int comparedFile = file.compareTo(o.file);
			if (comparedFile != 0) {
				return comparedFile;
			}
		}
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		int comparedColumn = Integer.compare(column, o.column);
		if (comparedColumn != 0) {
			return comparedColumn;
		}
		return Integer.compare(characterOffset, o.characterOffset);
	}
}
