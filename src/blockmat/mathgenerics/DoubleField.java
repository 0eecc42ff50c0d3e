package blockmat.mathgenerics;

import java.util.Locale;

// Floating point reals, zero meaning anything within ROUNDOFF_ERROR of zero.
// Kept for reading real-valued MatrixMarket files and for benchmarking, not for exact work.
public final class DoubleField implements Ring<Double> {

	public static final double ROUNDOFF_ERROR = 1e-8;
	public static final DoubleField INSTANCE = new DoubleField();

	private DoubleField() {}

	public static boolean nearZero(double v) { return (v < -ROUNDOFF_ERROR || v > ROUNDOFF_ERROR ? false : true); }

	@Override public Double zero() { return 0.0; }
	@Override public Double one() { return 1.0; }
	@Override public Double add(Double a, Double b) { return a + b; }
	@Override public Double subtract(Double a, Double b) { return a - b; }
	@Override public Double negate(Double a) { return -a; }
	@Override public Double multiply(Double a, Double b) { return a * b; }
	@Override public Double inverse(Double a) { return nearZero(a) ? null : 1.0 / a; }
	@Override public boolean isZero(Double a) { return nearZero(a); }
	@Override public boolean equal(Double a, Double b) { return nearZero(a - b); }
	@Override public boolean isField() { return true; }
	@Override public Double valueOf(long v) { return (double) v; }

	@Override
	public Double parse(String s) {
		try { return Double.valueOf(s.trim());
		} catch (NumberFormatException e) {
			throw new NumberFormatException("DoubleField.parse(): Not a real: \"" + s + "\".");
		}
	}

	// limits output to a short form the way matrix printouts expect it
	@Override
	public String format(Double a) {
		double v = a;
		if (nearZero(v - Math.rint(v)) && Math.abs(v) < 1e6) return Long.toString((long) Math.rint(v));
		return String.format(Locale.ROOT, "%.3g", v);
	}

	@Override public Double[] newArray(int size) { return new Double[size]; }
	@Override public String name() { return "R"; }
	@Override public String toString() { return name(); }
}
