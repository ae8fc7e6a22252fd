package labellint.model;

import labellint.util.ByteRange;

import java.util.Collections;
import java.util.List;

/**
 * One entry of a SourceKit structure tree. Offset and length are in UTF-8 bytes and are -1 when
 * SourceKit did not report them.
 */
public class StructureNode {
	private final String kind;
	private final int offset;
	private final int length;
	private final List<StructureNode> substructure;

	public StructureNode(String kind, int offset, int length, List<StructureNode> substructure) {
		this.kind = kind;
		this.offset = offset;
		this.length = length;
		this.substructure = Collections.unmodifiableList(substructure);
	}

	public static StructureNode emptyRoot() {
		return new StructureNode(null, -1, -1, Collections.emptyList());
	}

	public String getKind() {
		return kind;
	}

	public StatementKind getStatementKind() {
		return StatementKind.fromIdentifier(kind);
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	public boolean hasByteRange() {
		return offset >= 0 && length >= 0;
	}

	/**
	 * @return the node's byte range, or null if offset or length is missing
	 */
	public ByteRange getByteRange() {
		if (!hasByteRange()) {
			return null;
		}
		return new ByteRange(offset, length);
	}

	public List<StructureNode> getSubstructure() {
		return substructure;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((kind == null) ? 0 : kind.hashCode());
		result = prime * result + offset;
		result = prime * result + length;
		result = prime * result + substructure.hashCode();
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
		StructureNode other = (StructureNode) obj;
		if (kind == null) {
			if (other.kind != null)
				return false;
		} else if (!kind.equals(other.kind))
			return false;
		return offset == other.offset && length == other.length && substructure.equals(other.substructure);
	}

	@Override
	public String toString() {
		return "StructureNode [kind=" + kind + ", offset=" + offset + ", length=" + length +
				", substructure=" + substructure + "]";
	}
}
