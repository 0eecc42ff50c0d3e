package blockmat.matrixlib;

import blockmat.mathgenerics.Ring;


// The block triangular predicate: M is block triangular with respect to labelling b when M(i,j) = 0
// whenever b(j) < b(i), i.e. a nonzero entry needs a column label at least as large as its row label.
// This is the only convention used by the determinant and inversion engines.
public final class BlockTriangular {

	private BlockTriangular() {}

	public static <R, L extends Comparable<? super L>> boolean isBlockTriangular(Matrix<R> A, Labelling<L> b) {
		if (!A.isSquare()) return false;
		return firstViolation(A, LabelPartition.of(A.M, b)) == null;
	}

	// O(n^2) scan, throws InvalidInputException naming the first offending entry
	public static <R, L extends Comparable<? super L>> LabelPartition<L> validate(Matrix<R> A, Labelling<L> b) {
		checkSquare(A, "BlockTriangular.validate()");
		LabelPartition<L> part = LabelPartition.of(A.M, b);
		validate(A, part);
		return part;
	}

	static <R, L extends Comparable<? super L>> void validate(Matrix<R> A, LabelPartition<L> part) {
		int[] ij = firstViolation(A, part);
		if (ij != null)
			throw new InvalidInputException("BlockTriangular.validate(): Entry (" + ij[0] + "," + ij[1] + ") of " + A.name
					+ " is nonzero although its column label " + part.labelOf(ij[1]) + " is below its row label "
					+ part.labelOf(ij[0]) + ".");
	}

	private static <R, L extends Comparable<? super L>> int[] firstViolation(Matrix<R> A, LabelPartition<L> part) {
		Ring<R> ring = A.ring;
		for (int i = 0; i < A.M; i++) {
			L bi = part.labelOf(i);
			for (int j = 0, iN = i * A.N; j < A.N; j++)
				if (part.labelOf(j).compareTo(bi) < 0 && !ring.isZero(A.data[iN + j])) return new int[] { i, j };
		}
		return null;
	}

	// submatrix on { i | b(i) = a }, empty if no index carries label a
	public static <R, L extends Comparable<? super L>> Matrix<R> diagonalBlock(Matrix<R> A, Labelling<L> b, L a) {
		checkSquare(A, "BlockTriangular.diagonalBlock()");
		return BlockView.principal(A, LabelPartition.of(A.M, b).indicesAt(a));
	}

	static void checkSquare(Matrix<?> A, String method) {
		if (!A.isSquare())
			throw new InvalidInputException(method + ": Matrix " + A.name + " is " + A.M + "x" + A.N + ", not square.");
	}
}
