package labellint.util;

/**
 * A half-open range of UTF-8 byte offsets, the unit SourceKit reports structure and tokens in.
 */
public class ByteRange {
	private final int offset;
	private final int length;

	public ByteRange(int offset, int length) {
		this.offset = offset;
		this.length = length;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	public int getEndOffset() {
		return offset + length;
	}

	public boolean contains(int byteOffset) {
		return byteOffset >= offset && byteOffset < getEndOffset();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + offset;
		result = prime * result + length;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ByteRange other = (ByteRange) obj;
		return offset == other.offset && length == other.length;
	}

	@Override
	public String toString() {
		return "ByteRange [offset=" + offset + ", length=" + length + "]";
	}
}
