package blockmat.matrixlib;

import java.util.SortedMap;
import java.util.TreeMap;

import blockmat.mathgenerics.Ring;


// Determinant of a block triangular matrix as the product of its diagonal block determinants.
//
// The recursion removes one label per step. With k the largest remaining label and p = { b = k },
// every row of p has zeros in the columns of the complement, so the p block is isolated and
// det(M) = det(M[p][p]) * det(M[not p][not p]); the complement carries one label fewer.
// Taking the smallest label instead isolates the block the other way round (the complement's rows
// are zero in p's columns) and gives the same product.
public final class BlockTriangularDeterminant {

	public enum LabelOrder {
		DESCENDING,		// peel off the largest label first
		ASCENDING		// peel off the smallest label first
	}

	private BlockTriangularDeterminant() {}

	// validates the block structure first, then recurses from the largest label down
	public static <R, L extends Comparable<? super L>> R det(Matrix<R> A, Labelling<L> b) {
		return det(A, b, LabelOrder.DESCENDING, true);
	}

	// with validate = false the block structure is a precondition and is not checked
	public static <R, L extends Comparable<? super L>> R det(Matrix<R> A, Labelling<L> b, LabelOrder order, boolean validate) {
		BlockTriangular.checkSquare(A, "BlockTriangularDeterminant.det()");
		LabelPartition<L> part = LabelPartition.of(A.M, b);
		if (validate) BlockTriangular.validate(A, part);
		R det = detRecursive(A, part, order, 0);
		if (Matrix.DEBUG_LEVEL > 1) System.out.println("block triangular determinant of " + A.name + ": " + A.ring.format(det));
		return det;
	}


	private static <R, L extends Comparable<? super L>> R detRecursive(Matrix<R> A, LabelPartition<L> part,
			LabelOrder order, int depth) {

		Ring<R> ring = A.ring;
		if (part.isEmpty()) return ring.one();				// empty index set, empty product

		L k = order == LabelOrder.DESCENDING ? part.maxLabel() : part.minLabel();
		IndexSubset p = part.indicesAt(k), rest = p.complement();

		R detP = ScalarBlockKernel.det(BlockView.principal(A, p));
		if (Matrix.DEBUG_LEVEL > 1)
			System.out.println("  step " + depth + ": label " + k + ", block " + p.size() + "x" + p.size()
					+ ", det " + ring.format(detP) + ", remaining " + rest.size());

		R detRest = detRecursive(BlockView.principal(A, rest), part.restrict(rest), order, depth + 1);
		return ring.multiply(detP, detRest);
	}


	// determinant of every diagonal block, keyed by label in ascending order; their product is det(A)
	public static <R, L extends Comparable<? super L>> SortedMap<L, R> diagonalBlockDeterminants(Matrix<R> A, Labelling<L> b) {
		LabelPartition<L> part = BlockTriangular.validate(A, b);
		SortedMap<L, R> dets = new TreeMap<L, R>();
		for (L a : part.labels())
			dets.put(a, ScalarBlockKernel.det(BlockView.principal(A, part.indicesAt(a))));
		return dets;
	}
}
