package labellint.rules.lint;

import labellint.util.ByteRange;
import labellint.util.TextRange;

/**
 * The leading label of a statement: its name and where the name token sits.
 */
public class LabelCandidate {
	private final String name;
	private final TextRange characterRange;
	private final ByteRange byteRange;

	public LabelCandidate(String name, TextRange characterRange, ByteRange byteRange) {
		this.name = name;
		this.characterRange = characterRange;
		this.byteRange = byteRange;
	}

	public String getName() {
		return name;
	}

	public TextRange getCharacterRange() {
		return characterRange;
	}

	public ByteRange getByteRange() {
		return byteRange;
	}

	@Override
	public String toString() {
		return "LabelCandidate [name=" + name + ", characterRange=" + characterRange + "]";
	}
}
