package labellint.util;

/**
 * A half-open range of UTF-16 character offsets into a source text.
 */
public class TextRange implements Comparable<TextRange> {
	private final int location;
	private final int length;

	public TextRange(int location, int length) {
		this.location = location;
		this.length = length;
	}

	public int getLocation() {
		return location;
	}

	public int getLength() {
		return length;
	}

	public int getEnd() {
		return location + length;
	}

	public boolean contains(int offset) {
		return offset >= location && offset < getEnd();
	}

	public TextRange withLength(int newLength) {
		return new TextRange(location, newLength);
	}

	@Override
	public int compareTo(TextRange o) {
		int comparedLocation = Integer.compare(location, o.location);
		if (comparedLocation != 0) {
			return comparedLocation;
		}
		return Integer.compare(length, o.length);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + location;
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
		TextRange other = (TextRange) obj;
		return location == other.location && length == other.length;
	}

	@Override
	public String toString() {
		return "TextRange [location=" + location + ", length=" + length + "]";
	}
}
