package blockmat.matrixlib;

import static org.junit.Assert.*;

import java.math.BigInteger;

import org.junit.Test;

import blockmat.mathgenerics.BigIntegerRing;

public class BlockTriangularTest {

	private static final BigIntegerRing Z = BigIntegerRing.INSTANCE;

	// labels (1, 0, 1): rows 0 and 2 must be zero in column 1
	private static final Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] {
			{ 2, 0, 1 },
			{ 5, 3, 7 },
			{ 4, 0, 1 } });
	private static final Labelling<Integer> B = ArrayLabelling.ofInts(1, 0, 1);

	@Test
	public void testIsBlockTriangular() {
		assertTrue(BlockTriangular.isBlockTriangular(A, B));
		assertFalse(BlockTriangular.isBlockTriangular(A, ArrayLabelling.ofInts(0, 1, 0)));
		// a single label accepts any square matrix
		assertTrue(BlockTriangular.isBlockTriangular(A, ArrayLabelling.ofInts(0, 0, 0)));
		assertFalse(BlockTriangular.isBlockTriangular(new Matrix<BigInteger>("R", Z, 2, 3), ArrayLabelling.ofInts(0, 0)));
	}

	@Test
	public void testValidateNamesOffendingEntry() {
		try {
			BlockTriangular.validate(A, ArrayLabelling.ofInts(0, 1, 0));
			fail("violation not detected");
		} catch (InvalidInputException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("(1,0)"));
		}
	}

	@Test
	public void testValidateReturnsPartition() {
		LabelPartition<Integer> part = BlockTriangular.validate(A, B);
		assertEquals(2, part.labelCount());
		assertArrayEquals(new int[] { 0, 2 }, part.indicesAt(1).toArray());
	}

	@Test
	public void testDiagonalBlock() {
		assertEquals(Matrix.fromLongs("D", Z, new long[][] { { 2, 1 }, { 4, 1 } }), BlockTriangular.diagonalBlock(A, B, 1));
		assertEquals(Matrix.fromLongs("D", Z, new long[][] { { 3 } }), BlockTriangular.diagonalBlock(A, B, 0));
		assertTrue(BlockTriangular.diagonalBlock(A, B, 5).isEmpty());
	}

	@Test(expected = InvalidInputException.class)
	public void testValidateNonsquare() {
		BlockTriangular.validate(new Matrix<BigInteger>("R", Z, 2, 3), ArrayLabelling.ofInts(0, 0));
	}
}
