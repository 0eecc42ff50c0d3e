package blockmat.mathgenerics;

import java.math.BigInteger;

// The ring of integers, units are +1 and -1
public final class BigIntegerRing implements Ring<BigInteger> {

	public static final BigIntegerRing INSTANCE = new BigIntegerRing();

	private BigIntegerRing() {}

	@Override public BigInteger zero() { return BigInteger.ZERO; }
	@Override public BigInteger one() { return BigInteger.ONE; }
	@Override public BigInteger add(BigInteger a, BigInteger b) { return a.add(b); }
	@Override public BigInteger subtract(BigInteger a, BigInteger b) { return a.subtract(b); }
	@Override public BigInteger negate(BigInteger a) { return a.negate(); }
	@Override public BigInteger multiply(BigInteger a, BigInteger b) { return a.multiply(b); }

	@Override
	public BigInteger inverse(BigInteger a) {
		if (a.abs().equals(BigInteger.ONE)) return a;		// +1 and -1 are self-inverse
		return null;
	}

	@Override public boolean isZero(BigInteger a) { return a.signum() == 0; }
	@Override public boolean equal(BigInteger a, BigInteger b) { return a.equals(b); }
	@Override public boolean isField() { return false; }
	@Override public BigInteger valueOf(long v) { return BigInteger.valueOf(v); }

	@Override
	public BigInteger parse(String s) {
		try { return new BigInteger(s.trim());
		} catch (NumberFormatException e) {
			throw new NumberFormatException("BigIntegerRing.parse(): Not an integer: \"" + s + "\".");
		}
	}

	@Override public String format(BigInteger a) { return a.toString(); }
	@Override public BigInteger[] newArray(int size) { return new BigInteger[size]; }
	@Override public String name() { return "Z"; }
	@Override public String toString() { return name(); }
}
