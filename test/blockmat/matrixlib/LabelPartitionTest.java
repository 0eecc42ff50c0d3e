package blockmat.matrixlib;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class LabelPartitionTest {

	private static final LabelPartition<Integer> PART = LabelPartition.of(4, ArrayLabelling.ofInts(3, 1, 3, 2));

	@Test
	public void testLabels() {
		assertEquals(Arrays.asList(1, 2, 3), Arrays.asList(PART.labels().toArray(new Integer[0])));
		assertEquals(3, PART.labelCount());
		assertEquals(Integer.valueOf(3), PART.maxLabel());
		assertEquals(Integer.valueOf(1), PART.minLabel());
	}

	@Test
	public void testBlockPredicates() {
		assertArrayEquals(new int[] { 1, 3 }, PART.prefixIndices(3).toArray());
		assertArrayEquals(new int[] { 0, 2 }, PART.indicesAt(3).toArray());
		assertArrayEquals(new int[] { 1, 3 }, PART.indicesUpTo(2).toArray());
		assertArrayEquals(new int[] { 0, 2, 3 }, PART.indicesAbove(1).toArray());
		assertTrue(PART.prefixIndices(1).isEmpty());
		assertTrue(PART.indicesAt(7).isEmpty());
	}

	@Test
	public void testRestrict() {
		LabelPartition<Integer> r = PART.restrict(IndexSubset.ofIndexes(4, 0, 2, 3));
		assertEquals(3, r.size());
		assertEquals(Integer.valueOf(2), r.labelOf(2));
		assertEquals(2, r.labelCount());
		assertEquals(Integer.valueOf(2), r.minLabel());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testLabelsUnmodifiable() {
		PART.labels().add(9);
	}

	@Test(expected = EmptyDomainException.class)
	public void testEmptyHasNoMaximum() {
		LabelPartition.of(0, ArrayLabelling.ofInts()).maxLabel();
	}

	@Test(expected = InvalidInputException.class)
	public void testSizeMismatch() {
		LabelPartition.of(3, ArrayLabelling.ofInts(0, 1));
	}

	@Test(expected = InvalidInputException.class)
	public void testNullLabel() {
		LabelPartition.of(2, new Labelling<String>() {
			@Override public String labelOf(int i) { return i == 0 ? "a" : null; }
		});
	}
}
