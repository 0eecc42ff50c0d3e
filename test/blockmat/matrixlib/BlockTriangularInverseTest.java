package blockmat.matrixlib;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;

import org.junit.Test;

import blockmat.mathgenerics.BigIntegerRing;
import blockmat.mathgenerics.ModularRing;
import blockmat.mathgenerics.Rational;
import blockmat.mathgenerics.RationalField;

public class BlockTriangularInverseTest {

	private static final BigIntegerRing Z = BigIntegerRing.INSTANCE;
	private static final RationalField Q = RationalField.INSTANCE;

	@Test
	public void testTwoBlocks() {
		Matrix<Rational> B = Matrix.fromLongs("B", Q, new long[][] {
				{ 4, 7, 1, 2 },
				{ 2, 6, 3, 1 },
				{ 0, 0, 1, 2 },
				{ 0, 0, 3, 4 } });
		Labelling<Integer> b = ArrayLabelling.ofInts(0, 0, 1, 1);
		Matrix<Rational> Bi = BlockTriangularInverse.invert(B, b);

		assertTrue(B.multiply(Bi).isIdentity());
		assertTrue(Bi.multiply(B).isIdentity());
		assertEquals(Rational.of(3, 5), Bi.valueOf(0, 0));
		assertEquals(Rational.of(-7, 10), Bi.valueOf(0, 1));
		assertEquals(Rational.of(3, 2), Bi.valueOf(3, 2));
		assertTrue(BlockView.extract(Bi, IndexSubset.ofIndexes(4, 2, 3), IndexSubset.ofIndexes(4, 0, 1)).isZero());

		// each diagonal block of the inverse is the kernel inverse of the matching block
		LabelPartition<Integer> part = LabelPartition.of(4, b);
		for (Integer a : part.labels()) {
			IndexSubset s = part.indicesAt(a);
			assertEquals("label " + a, ScalarBlockKernel.inverse(BlockView.principal(B, s)), BlockView.principal(Bi, s));
		}
	}

	@Test
	public void testRandomAgainstKernel() {
		Random rnd = new Random(17);
		for (int n = 1; n <= 10; n++) {
			int[] labels = RandomBlockTriangular.randomLabels(n, Math.min(n, 5), rnd);
			Labelling<Integer> b = ArrayLabelling.ofInts(labels);
			Matrix<Rational> A = RandomBlockTriangular.generate("A", Q, labels, 0.5, 7, true, rnd);
			Matrix<Rational> Ai = BlockTriangularInverse.invert(A, b);
			assertEquals("size " + n, ScalarBlockKernel.inverse(A), Ai);
			assertTrue("size " + n, BlockTriangular.isBlockTriangular(Ai, b));
			assertEquals("size " + n, A, BlockTriangularInverse.invert(Ai, b));
		}
	}

	@Test
	public void testPrefixInverses() {
		Random rnd = new Random(3);
		int[] labels = { 4, 1, 2, 1, 4, 2, 3 };
		Labelling<Integer> b = ArrayLabelling.ofInts(labels);
		Matrix<Rational> A = RandomBlockTriangular.generate("A", Q, labels, 0.8, 5, true, rnd);
		Matrix<Rational> Ai = BlockTriangularInverse.invert(A, b);
		LabelPartition<Integer> part = LabelPartition.of(labels.length, b);

		SortedMap<Integer, Matrix<Rational>> prefixes = BlockTriangularInverse.prefixInverses(A, b);
		assertEquals(part.labels(), prefixes.keySet());
		assertTrue(prefixes.get(1).isEmpty());
		for (Map.Entry<Integer, Matrix<Rational>> e : prefixes.entrySet()) {
			IndexSubset P = part.prefixIndices(e.getKey());
			assertEquals("label " + e.getKey(), ScalarBlockKernel.inverse(BlockView.principal(A, P)), e.getValue());
			assertEquals("label " + e.getKey(), BlockView.principal(Ai, P), e.getValue());
		}
	}

	@Test
	public void testPrefixInverseAtAnyThreshold() {
		Matrix<Rational> A = Matrix.fromLongs("A", Q, new long[][] {
				{ 2, 0, 1, 1 },
				{ 0, 4, 5, 1 },
				{ 0, 0, 1, 0 },
				{ 0, 0, 0, 1 } });
		Labelling<Integer> b = ArrayLabelling.ofInts(0, 0, 2, 2);
		Matrix<Rational> P = BlockTriangularInverse.prefixInverse(A, b, 1);
		assertEquals(2, P.rows());
		assertEquals(Rational.of(1, 2), P.valueOf(0, 0));
		assertEquals(Rational.of(1, 4), P.valueOf(1, 1));
		assertTrue(BlockTriangularInverse.prefixInverse(A, b, 0).isEmpty());
		assertEquals(BlockTriangularInverse.invert(A, b), BlockTriangularInverse.prefixInverse(A, b, 3));
	}

	@Test
	public void testSingularBlock() {
		Matrix<Rational> A = Matrix.fromLongs("A", Q, new long[][] { { 1, 5 }, { 0, 0 } });
		try {
			BlockTriangularInverse.invert(A, ArrayLabelling.ofInts(0, 1));
			fail("singular matrix inverted");
		} catch (InternalInconsistencyException e) {
			assertEquals(Integer.valueOf(1), e.getLabel());
			assertTrue(e.getCause() instanceof SingularMatrixException);
		}
	}

	@Test
	public void testNonUnitBlockOverIntegers() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 2, 1 }, { 0, 1 } });
		try {
			BlockTriangularInverse.invert(A, ArrayLabelling.ofInts(0, 1));
			fail("non-unit determinant inverted over Z");
		} catch (InternalInconsistencyException e) {
			assertEquals(Integer.valueOf(0), e.getLabel());
		}
	}

	@Test
	public void testUnimodularOverIntegers() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] {
				{ 1, 2, 3 },
				{ 0, 1, 4 },
				{ 0, 0, -1 } });
		Matrix<BigInteger> Ai = BlockTriangularInverse.invert(A, ArrayLabelling.ofInts(0, 1, 2));
		assertTrue(A.multiply(Ai).isIdentity());
		assertEquals(Matrix.fromLongs("Ai", Z, new long[][] { { 1, -2, -5 }, { 0, 1, 4 }, { 0, 0, -1 } }), Ai);
	}

	@Test
	public void testModularField() {
		Random rnd = new Random(31);
		ModularRing F7 = new ModularRing(7);
		int[] labels = { 1, 0, 1, 2, 0, 2 };
		Matrix<Long> A = RandomBlockTriangular.generate("A", F7, labels, 0.5, 3, true, rnd);
		Matrix<Long> Ai = BlockTriangularInverse.invert(A, ArrayLabelling.ofInts(labels));
		assertTrue(A.multiply(Ai).isIdentity());
	}

	@Test
	public void testEmptyMatrix() {
		assertTrue(BlockTriangularInverse.invert(new Matrix<BigInteger>("E", Z, 0, 0), ArrayLabelling.ofInts()).isEmpty());
	}

	@Test(expected = InvalidInputException.class)
	public void testRejectsNonBlockTriangular() {
		Matrix<Rational> A = Matrix.fromLongs("A", Q, new long[][] { { 1, 0 }, { 1, 1 } });
		BlockTriangularInverse.invert(A, ArrayLabelling.ofInts(0, 1));
	}
}
