package labellint.util;

import java.util.Arrays;

/**
 * Converts between UTF-8 byte offsets, which SourceKit uses for structure and syntax data,
 * and UTF-16 character offsets, which Java strings and reported locations use.
 *
 * Offsets that do not fall on a character boundary cannot be converted; the conversion
 * methods return -1 (or null for ranges) in that case.
 */
public class OffsetBridge {
	private final String contents;
	// byteOffsetOfChar[i] is the byte offset of character index i, or -1 for the second half of a surrogate pair
	private final int[] byteOffsetOfChar;
	// charOffsetOfByte[b] is the character index starting at byte b, or -1 inside a multi-byte sequence
	private final int[] charOffsetOfByte;

	public OffsetBridge(String contents) {
		this.contents = contents;
		int length = contents.length();
		byteOffsetOfChar = new int[length + 1];
		int pos = 0;
		for (int i = 0; i < length; i++) {
			byteOffsetOfChar[i] = pos;
			char c = contents.charAt(i);
			if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(contents.charAt(i + 1))) {
				byteOffsetOfChar[i + 1] = -1;
				pos += 4;
				i++;
			} else if (c < 0x80) {
				pos += 1;
			} else if (c < 0x800) {
				pos += 2;
			} else {
				pos += 3;
			}
		}
		byteOffsetOfChar[length] = pos;

		charOffsetOfByte = new int[pos + 1];
		Arrays.fill(charOffsetOfByte, -1);
		for (int i = 0; i <= length; i++) {
			if (byteOffsetOfChar[i] != -1) {
				charOffsetOfByte[byteOffsetOfChar[i]] = i;
			}
		}
	}

	public String getContents() {
		return contents;
	}

	public int getByteLength() {
		return byteOffsetOfChar[contents.length()];
	}

	public int byteOffsetToCharacterOffset(int byteOffset) {
		if (byteOffset < 0 || byteOffset >= charOffsetOfByte.length) {
			return -1;
		}
		return charOffsetOfByte[byteOffset];
	}

	public int characterOffsetToByteOffset(int characterOffset) {
		if (characterOffset < 0 || characterOffset >= byteOffsetOfChar.length) {
			return -1;
		}
		return byteOffsetOfChar[characterOffset];
	}

	public TextRange byteRangeToTextRange(int byteOffset, int byteLength) {
		if (byteLength < 0) {
			return null;
		}
		int start = byteOffsetToCharacterOffset(byteOffset);
		int end = byteOffsetToCharacterOffset(byteOffset + byteLength);
		if (start == -1 || end == -1) {
			return null;
		}
		return new TextRange(start, end - start);
	}

	public TextRange byteRangeToTextRange(ByteRange range) {
		return byteRangeToTextRange(range.getOffset(), range.getLength());
	}

	public ByteRange textRangeToByteRange(TextRange range) {
		if (range.getLength() < 0) {
			return null;
		}
		int start = characterOffsetToByteOffset(range.getLocation());
		int end = characterOffsetToByteOffset(range.getEnd());
		if (start == -1 || end == -1) {
			return null;
		}
		return new ByteRange(start, end - start);
	}

	public String substringWithByteRange(int byteOffset, int byteLength) {
		TextRange range = byteRangeToTextRange(byteOffset, byteLength);
		if (range == null) {
			return null;
		}
		return contents.substring(range.getLocation(), range.getEnd());
	}
}
