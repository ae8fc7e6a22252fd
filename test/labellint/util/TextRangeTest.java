package labellint.util;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class TextRangeTest {

	@Test
	public void halfOpen() {
		TextRange range = new TextRange(3, 4);
		assertThat(range.getEnd(), is(7));
		assertFalse(range.contains(2));
		assertTrue(range.contains(3));
		assertTrue(range.contains(6));
		assertFalse(range.contains(7));
	}

	@Test
	public void orderedByLocationThenLength() {
		List<TextRange> ranges = new ArrayList<>(Arrays.asList(
				new TextRange(10, 2), new TextRange(0, 4), new TextRange(10, 1)));
		Collections.sort(ranges);
		assertThat(ranges, is(Arrays.asList(new TextRange(0, 4), new TextRange(10, 1), new TextRange(10, 2))));
	}

	@Test
	public void valueEquality() {
		assertThat(new TextRange(1, 2), is(new TextRange(1, 2)));
		assertThat(new TextRange(1, 2).hashCode(), is(new TextRange(1, 2).hashCode()));
		assertThat(new TextRange(1, 2), is(not(new TextRange(1, 3))));
		assertThat(new TextRange(1, 2).withLength(5), is(new TextRange(1, 5)));
	}
}
