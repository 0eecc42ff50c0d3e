package blockmat.mathgenerics;

// Capability of a commutative ring with identity, as consumed by the matrix classes.
// Element values are treated as immutable, a ring implementation never mutates its arguments.
// inverse() answers null for a non-unit, a field answers null only for zero.
public interface Ring<R> {

	R zero();
	R one();

	R add(R a, R b);
	R subtract(R a, R b);
	R negate(R a);
	R multiply(R a, R b);

	// multiplicative inverse of a unit, null if a has none
	R inverse(R a);

	boolean isZero(R a);
	boolean equal(R a, R b);

	// true if every nonzero element is a unit, which lets the kernel eliminate instead of expanding
	boolean isField();

	R valueOf(long v);

	// parses the textual form of an element as found in MatrixMarket files
	R parse(String s);

	// short printable form, used by Matrix.toString()
	String format(R a);

	// array allocation for the matrix data field
	R[] newArray(int size);

	String name();
}
