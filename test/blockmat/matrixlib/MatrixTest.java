package blockmat.matrixlib;

import static org.junit.Assert.*;

import java.math.BigInteger;

import org.junit.Test;

import blockmat.mathgenerics.BigIntegerRing;
import blockmat.mathgenerics.Rational;
import blockmat.mathgenerics.RationalField;

public class MatrixTest {

	private static final BigIntegerRing Z = BigIntegerRing.INSTANCE;

	@Test
	public void testMultiply() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1, 2 }, { 3, 4 } });
		Matrix<BigInteger> B = Matrix.fromLongs("B", Z, new long[][] { { 0, 1 }, { 1, 0 } });
		assertEquals(Matrix.fromLongs("C", Z, new long[][] { { 2, 1 }, { 4, 3 } }), A.multiply(B));
		assertEquals(A, A.multiply(Matrix.identity(Z, 2)));
	}

	@Test
	public void testRectangularMultiplyAndTranspose() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1, 2, 3 } });
		Matrix<BigInteger> At = A.transpose();
		assertEquals(3, At.rows());
		assertEquals(1, At.cols());
		assertEquals(Matrix.fromLongs("P", Z, new long[][] { { 14 } }), A.multiply(At));
	}

	@Test(expected = InvalidInputException.class)
	public void testNonmatchingMultiply() {
		Matrix.fromLongs("A", Z, new long[][] { { 1, 2 } }).multiply(Matrix.fromLongs("B", Z, new long[][] { { 1, 2 } }));
	}

	@Test
	public void testAddSubtractNegate() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1, -2 }, { 0, 4 } });
		assertTrue(A.subtract(A).isZero());
		assertEquals(A.negate(), Matrix.fromLongs("N", Z, new long[][] { { -1, 2 }, { 0, -4 } }));
		assertEquals(A.add(A), A.multiply(BigInteger.valueOf(2)));
	}

	@Test
	public void testEliminateRowColumn() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1, 2, 3 }, { 4, 5, 6 }, { 7, 8, 9 } });
		assertEquals(Matrix.fromLongs("M", Z, new long[][] { { 1, 3 }, { 7, 9 } }), A.eliminateRowColumn(1, 1));
	}

	@Test
	public void testEmptyMatrix() {
		Matrix<BigInteger> E = new Matrix<BigInteger>("E", Z, 0, 0);
		assertTrue(E.isEmpty());
		assertTrue(E.isSquare());
		assertTrue(E.isIdentity());
		assertEquals(E, Matrix.identity(Z, 0));
		assertTrue(E.toString().contains("[empty]"));
	}

	@Test
	public void testCloneIsIndependent() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1, 2 }, { 3, 4 } });
		Matrix<BigInteger> C = A.clone();
		C.valueTo(0, 0, BigInteger.TEN);
		assertEquals(BigInteger.ONE, A.valueOf(0, 0));
		assertFalse(A.equals(C));
	}

	@Test
	public void testEqualsNeedsSameRing() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 1 } });
		Matrix<Rational> B = Matrix.fromLongs("B", RationalField.INSTANCE, new long[][] { { 1 } });
		assertFalse(A.equals(B));
	}

	@Test
	public void testToStringMarksZeros() {
		Matrix<BigInteger> A = Matrix.fromLongs("A", Z, new long[][] { { 12, 0 }, { 0, -3 } });
		String s = A.toString();
		assertTrue(s.contains("12"));
		assertTrue(s.contains("-3"));
		assertTrue(s.contains("    -"));
	}

	@Test(expected = InvalidInputException.class)
	public void testRaggedRows() {
		Matrix.fromLongs("A", Z, new long[][] { { 1, 2 }, { 3 } });
	}
}
