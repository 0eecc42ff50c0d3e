package blockmat.mathgenerics;

// The field of rationals over exact Rational values
public final class RationalField implements Ring<Rational> {

	public static final RationalField INSTANCE = new RationalField();

	private RationalField() {}

	@Override public Rational zero() { return Rational.ZERO; }
	@Override public Rational one() { return Rational.ONE; }
	@Override public Rational add(Rational a, Rational b) { return a.add(b); }
	@Override public Rational subtract(Rational a, Rational b) { return a.subtract(b); }
	@Override public Rational negate(Rational a) { return a.negate(); }
	@Override public Rational multiply(Rational a, Rational b) { return a.multiply(b); }
	@Override public Rational inverse(Rational a) { return a.signum() == 0 ? null : a.reciprocal(); }
	@Override public boolean isZero(Rational a) { return a.signum() == 0; }
	@Override public boolean equal(Rational a, Rational b) { return a.equals(b); }
	@Override public boolean isField() { return true; }
	@Override public Rational valueOf(long v) { return Rational.of(v); }

	@Override
	public Rational parse(String s) {
		try { return Rational.parse(s);
		} catch (NumberFormatException | ArithmeticException e) {
			throw new NumberFormatException("RationalField.parse(): Not a rational: \"" + s + "\".");
		}
	}

	@Override public String format(Rational a) { return a.toString(); }
	@Override public Rational[] newArray(int size) { return new Rational[size]; }
	@Override public String name() { return "Q"; }
	@Override public String toString() { return name(); }
}
