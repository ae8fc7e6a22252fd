package labellint.lexer;

import labellint.util.ByteRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The classified tokens of one source file, ordered by byte offset.
 */
public class SyntaxMap {

	private final List<SyntaxToken> tokens;

	public SyntaxMap(List<SyntaxToken> tokens) {
		List<SyntaxToken> sorted = new ArrayList<>(tokens);
		sorted.sort(Comparator.comparingInt(SyntaxToken::getOffset));
		this.tokens = Collections.unmodifiableList(sorted);
	}

	public static SyntaxMap empty() {
		return new SyntaxMap(Collections.emptyList());
	}

	public List<SyntaxToken> getTokens() {
		return tokens;
	}

	public boolean isEmpty() {
		return tokens.isEmpty();
	}

	/**
	 * @return the tokens whose start offset lies within range, in source order
	 */
	public List<SyntaxToken> tokensInByteRange(ByteRange range) {
		int from = firstIndexAtOrAfter(range.getOffset());
		int to = firstIndexAtOrAfter(range.getEndOffset());
		if (from >= to) {
			return Collections.emptyList();
		}
		return tokens.subList(from, to);
	}

	/**
	 * @return the first token starting strictly after byteOffset, or null if there is none
	 */
	public SyntaxToken firstTokenAfterByteOffset(int byteOffset) {
		int index = firstIndexAtOrAfter(byteOffset + 1);
		if (index >= tokens.size()) {
			return null;
		}
		return tokens.get(index);
	}

	// lower bound search over token start offsets
	private int firstIndexAtOrAfter(int byteOffset) {
		int low = 0;
		int high = tokens.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (tokens.get(mid).getOffset() < byteOffset) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}

	@Override
	public String toString() {
		return "SyntaxMap [tokens=" + tokens + "]";
	}
}
