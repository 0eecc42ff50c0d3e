package blockmat.mathgenerics;

import static org.junit.Assert.*;

import java.math.BigInteger;

import org.junit.Test;

public class RingsTest {

	@Test
	public void testIntegerUnits() {
		BigIntegerRing Z = BigIntegerRing.INSTANCE;
		assertEquals(BigInteger.ONE, Z.inverse(BigInteger.ONE));
		assertEquals(BigInteger.valueOf(-1), Z.inverse(BigInteger.valueOf(-1)));
		assertNull(Z.inverse(BigInteger.valueOf(2)));
		assertNull(Z.inverse(BigInteger.ZERO));
		assertFalse(Z.isField());
	}

	@Test(expected = NumberFormatException.class)
	public void testIntegerParseRejectsFraction() {
		BigIntegerRing.INSTANCE.parse("1/2");
	}

	@Test
	public void testModularPrime() {
		ModularRing F7 = new ModularRing(7);
		assertTrue(F7.isField());
		assertEquals(Long.valueOf(5), F7.inverse(3L));			// 3 * 5 = 15 = 1 mod 7
		assertEquals(Long.valueOf(6), F7.valueOf(-1));
		assertEquals(Long.valueOf(2), F7.multiply(4L, 4L));		// 16 mod 7
		assertEquals(Long.valueOf(4), F7.parse("-3"));
	}

	@Test
	public void testModularComposite() {
		ModularRing Z6 = new ModularRing(6);
		assertFalse(Z6.isField());
		assertNull(Z6.inverse(2L));
		assertNull(Z6.inverse(3L));
		assertEquals(Long.valueOf(5), Z6.inverse(5L));
		assertTrue(Z6.isZero(Z6.multiply(2L, 3L)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testModularRejectsTinyModulus() {
		new ModularRing(1);
	}

	@Test
	public void testDoubleNearZero() {
		DoubleField R = DoubleField.INSTANCE;
		assertTrue(R.isZero(1e-10));
		assertFalse(R.isZero(1e-3));
		assertNull(R.inverse(0.0));
		assertTrue(R.equal(0.1 + 0.2, 0.3));
		assertEquals("3", R.format(3.0));
		assertEquals("0.333", R.format(1.0 / 3));
	}
}
