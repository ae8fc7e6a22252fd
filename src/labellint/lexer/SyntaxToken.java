package labellint.lexer;

import labellint.util.ByteRange;

public class SyntaxToken {

	SyntaxKind type;
	int offset;
	int length;

	public SyntaxToken(SyntaxKind type, int offset, int length) {
		this.type = type;
		this.offset = offset;
		this.length = length;
	}

	public SyntaxKind getType() {
		return type;
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

	public ByteRange getByteRange() {
		return new ByteRange(offset, length);
	}

	@Override
	public String toString() {
		return "SyntaxToken [type=" + type + ", offset=" + offset + ", length=" + length + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((type == null) ? 0 : type.hashCode());
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
		SyntaxToken other = (SyntaxToken) obj;
		return type == other.type && offset == other.offset && length == other.length;
	}

}
