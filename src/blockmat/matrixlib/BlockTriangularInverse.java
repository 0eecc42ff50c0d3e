package blockmat.matrixlib;

import java.util.SortedMap;
import java.util.TreeMap;


// Inverse of an invertible block triangular matrix, built by block back-substitution over the labels.
//
// With k the largest label, P = { b < k } and Q = { b = k }, the matrix splits as
//
//		| A  B |			| A^-1   -A^-1.B.D^-1 |
//		| 0  D |	->		|  0         D^-1     |
//
// where A = M[P][P] is inverted recursively on one label fewer, D = M[Q][Q] by the scalar kernel.
// The zero block M[Q][P] stays zero in the inverse, so the inverse is block triangular for the same labelling,
// and the recursively built A^-1 is exactly the inverse's restriction to P x P (the prefix inverse at k).
public final class BlockTriangularInverse {

	private BlockTriangularInverse() {}

	public static <R, L extends Comparable<? super L>> Matrix<R> invert(Matrix<R> A, Labelling<L> b) {
		return invert(A, b, true);
	}

	// with validate = false the block structure is a precondition and is not checked
	public static <R, L extends Comparable<? super L>> Matrix<R> invert(Matrix<R> A, Labelling<L> b, boolean validate) {
		BlockTriangular.checkSquare(A, "BlockTriangularInverse.invert()");
		LabelPartition<L> part = LabelPartition.of(A.M, b);
		if (validate) BlockTriangular.validate(A, part);
		Matrix<R> Ai = invertRecursive(A, part, null, 0);
		if (Matrix.DEBUG_LEVEL > 1) {
			System.out.println("block triangular inverse:");
			System.out.println(Ai.toString());
		}
		return Ai;
	}


	// inverse of the prefix block { b < k } for every occurring label k, keyed ascending;
	// the smallest label maps to the empty matrix. All of them are restrictions of the full inverse.
	public static <R, L extends Comparable<? super L>> SortedMap<L, Matrix<R>> prefixInverses(Matrix<R> A, Labelling<L> b) {
		LabelPartition<L> part = BlockTriangular.validate(A, b);
		SortedMap<L, Matrix<R>> prefixes = new TreeMap<L, Matrix<R>>();
		invertRecursive(A, part, prefixes, 0);
		return prefixes;
	}


	// inverse of the principal block { b < k } for any threshold k, occurring as a label or not
	public static <R, L extends Comparable<? super L>> Matrix<R> prefixInverse(Matrix<R> A, Labelling<L> b, L k) {
		LabelPartition<L> part = BlockTriangular.validate(A, b);
		IndexSubset P = part.prefixIndices(k);
		return invertRecursive(BlockView.principal(A, P), part.restrict(P), null, 0);
	}


	private static <R, L extends Comparable<? super L>> Matrix<R> invertRecursive(Matrix<R> A, LabelPartition<L> part,
			SortedMap<L, Matrix<R>> prefixes, int depth) {

		if (part.isEmpty()) return new Matrix<R>("I", A.ring, 0, 0);	// nothing to invert

		L k = part.maxLabel();
		IndexSubset Q = part.indicesAt(k), P = Q.complement();			// P = prefixIndices(k), as k is the largest label

		Matrix<R> Di;
		try {
			Di = ScalarBlockKernel.inverseOrThrow(BlockView.principal(A, Q));
		} catch (SingularMatrixException e) {
			throw new InternalInconsistencyException("BlockTriangularInverse.invert(): Diagonal block at label " + k
					+ " is singular, the matrix is not invertible.", k, e);
		}

		Matrix<R> Ai = invertRecursive(BlockView.principal(A, P), part.restrict(P), prefixes, depth + 1);
		if (prefixes != null) prefixes.put(k, Ai);
		if (Matrix.DEBUG_LEVEL > 1)
			System.out.println("  step " + depth + ": label " + k + ", prefix " + P.size() + "x" + P.size()
					+ ", diagonal block " + Q.size() + "x" + Q.size());

		if (P.isEmpty()) return Di;

		// off-diagonal block -A^-1.B.D^-1, the bottom-left block is left zero
		Matrix<R> X = Ai.multiply(BlockView.extract(A, P, Q)).multiply(Di).negate();
		return BlockView.combine(P, Q, Ai, X, null, Di);
	}
}
