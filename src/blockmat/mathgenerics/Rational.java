package blockmat.mathgenerics;

import java.math.BigDecimal;
import java.math.BigInteger;

// Exact fraction num/den, always kept reduced with a positive denominator
public final class Rational implements Comparable<Rational> {

	public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
	public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

	private final BigInteger num, den;

	private Rational(BigInteger num, BigInteger den) {
		this.num = num;
		this.den = den;
	}

	public static Rational of(long num) { return of(BigInteger.valueOf(num), BigInteger.ONE); }
	public static Rational of(long num, long den) { return of(BigInteger.valueOf(num), BigInteger.valueOf(den)); }

	public static Rational of(BigInteger num, BigInteger den) {
		if (den.signum() == 0) throw new ArithmeticException("Rational.of(): Zero denominator.");
		if (num.signum() == 0) return ZERO;
		if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
		BigInteger gcd = num.gcd(den);
		if (!gcd.equals(BigInteger.ONE)) { num = num.divide(gcd); den = den.divide(gcd); }
		return new Rational(num, den);
	}

	// accepts "p", "p/q" and plain decimals such as "-1.25" or "3e-2"
	public static Rational parse(String s) {
		s = s.trim();
		int slash = s.indexOf('/');
		if (slash >= 0)
			return of(new BigInteger(s.substring(0, slash).trim()), new BigInteger(s.substring(slash + 1).trim()));
		BigDecimal d = new BigDecimal(s);
		if (d.scale() <= 0) return of(d.toBigIntegerExact(), BigInteger.ONE);
		return of(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
	}

	public BigInteger numerator() { return num; }
	public BigInteger denominator() { return den; }
	public int signum() { return num.signum(); }
	public boolean isInteger() { return den.equals(BigInteger.ONE); }

	public Rational add(Rational b) {
		if (den.equals(b.den)) return of(num.add(b.num), den);
		return of(num.multiply(b.den).add(b.num.multiply(den)), den.multiply(b.den));
	}

	public Rational subtract(Rational b) { return add(b.negate()); }
	public Rational negate() { return num.signum() == 0 ? this : new Rational(num.negate(), den); }

	public Rational multiply(Rational b) {
		if (num.signum() == 0 || b.num.signum() == 0) return ZERO;
		return of(num.multiply(b.num), den.multiply(b.den));
	}

	public Rational reciprocal() {
		if (num.signum() == 0) throw new ArithmeticException("Rational.reciprocal(): Division by zero.");
		return of(den, num);
	}

	public Rational divide(Rational b) { return multiply(b.reciprocal()); }

	@Override
	public int compareTo(Rational b) { return num.multiply(b.den).compareTo(b.num.multiply(den)); }

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Rational)) return false;
		Rational b = (Rational) o;
		return num.equals(b.num) && den.equals(b.den);
	}

	@Override
	public int hashCode() { return 31 * num.hashCode() + den.hashCode(); }

	@Override
	public String toString() { return isInteger() ? num.toString() : num + "/" + den; }
}
