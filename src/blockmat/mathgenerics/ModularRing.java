package blockmat.mathgenerics;

import java.math.BigInteger;

// The ring Z/nZ with elements kept in 0..n-1, a field only when n is prime.
// For composite n the ring has zero divisors, so the kernel falls back to cofactor expansion.
public final class ModularRing implements Ring<Long> {

	private final long modulus;
	private final boolean prime;

	public ModularRing(long modulus) {
		if (modulus < 2 || modulus > (1L << 31))
			throw new IllegalArgumentException("ModularRing(): Modulus must lie within 2..2^31.");
		this.modulus = modulus;
		this.prime = BigInteger.valueOf(modulus).isProbablePrime(40);
	}

	public long modulus() { return modulus; }

	private long reduce(long v) {
		long r = v % modulus;
		return r < 0 ? r + modulus : r;
	}

	@Override public Long zero() { return 0L; }
	@Override public Long one() { return 1L; }
	@Override public Long add(Long a, Long b) { return reduce(a + b); }
	@Override public Long subtract(Long a, Long b) { return reduce(a - b); }
	@Override public Long negate(Long a) { return reduce(-a); }
	@Override public Long multiply(Long a, Long b) { return reduce(a * b); }	// operands below 2^31, product fits

	@Override
	public Long inverse(Long a) {
		BigInteger ba = BigInteger.valueOf(a), bm = BigInteger.valueOf(modulus);
		if (!ba.gcd(bm).equals(BigInteger.ONE)) return null;
		return ba.modInverse(bm).longValue();
	}

	@Override public boolean isZero(Long a) { return a == 0; }
	@Override public boolean equal(Long a, Long b) { return a.longValue() == b.longValue(); }
	@Override public boolean isField() { return prime; }
	@Override public Long valueOf(long v) { return reduce(v); }

	@Override
	public Long parse(String s) {
		try { return reduce(Long.parseLong(s.trim()));
		} catch (NumberFormatException e) {
			throw new NumberFormatException("ModularRing.parse(): Not an integer: \"" + s + "\".");
		}
	}

	@Override public String format(Long a) { return a.toString(); }
	@Override public Long[] newArray(int size) { return new Long[size]; }
	@Override public String name() { return "Z/" + modulus; }
	@Override public String toString() { return name(); }
}
