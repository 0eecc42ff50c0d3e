package blockmat.matrixlib;

// Grading function b from matrix indexes 0..n-1 to a linearly ordered label type
public interface Labelling<L extends Comparable<? super L>> {

	L labelOf(int i);
}
