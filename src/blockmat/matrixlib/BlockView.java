package blockmat.matrixlib;


// Slicing and assembly of matrix blocks by index subsets.
// Blocks are copies: a block taken from a matrix never aliases the matrix data.
public final class BlockView {

	private BlockView() {}

	// submatrix restricted to the rows in "rows" and the columns in "cols", in ascending index order
	public static <R> Matrix<R> extract(Matrix<R> A, IndexSubset rows, IndexSubset cols) {

		if (rows.universe() != A.M || cols.universe() != A.N)
			throw new InvalidInputException("BlockView.extract(): Index subsets do not match matrix dimensions.");

		String newname = Matrix.DEBUG_LEVEL > 1 ? A.name + "[" + rows.size() + "x" + cols.size() + "]" : "B";
		Matrix<R> B = new Matrix<R>(newname, A.ring, rows.size(), cols.size());
		for (int r = 0, rN = 0; r < B.M; r++, rN += B.N) {
			int iN = rows.indexAt(r) * A.N;
			for (int c = 0; c < B.N; c++)
				B.data[rN + c] = A.data[iN + cols.indexAt(c)];
		}
		return B;
	}

	public static <R> Matrix<R> extract(Matrix<R> A, IndexPredicate rowPred, IndexPredicate colPred) {
		return extract(A, IndexSubset.of(A.M, rowPred), IndexSubset.of(A.N, colPred));
	}

	// principal submatrix on one index subset
	public static <R> Matrix<R> principal(Matrix<R> A, IndexSubset s) { return extract(A, s, s); }


	// assembles a square matrix from a two-way split P, Q of its index set:
	// topLeft is P x P, topRight P x Q, bottomLeft Q x P, bottomRight Q x Q; a null block stands for a zero block
	public static <R> Matrix<R> combine(IndexSubset P, IndexSubset Q, Matrix<R> topLeft, Matrix<R> topRight,
			Matrix<R> bottomLeft, Matrix<R> bottomRight) {

		int n = P.universe();
		if (Q.universe() != n || P.size() + Q.size() != n)
			throw new InvalidInputException("BlockView.combine(): Index subsets do not partition the index set.");
		for (int i = 0; i < n; i++)
			if (P.contains(i) == Q.contains(i))
				throw new InvalidInputException("BlockView.combine(): Index " + i + " is not in exactly one subset.");

		Matrix<R> any = topLeft != null ? topLeft : topRight != null ? topRight : bottomLeft != null ? bottomLeft : bottomRight;
		if (any == null) throw new InvalidInputException("BlockView.combine(): At least one block must be given.");

		checkBlock(topLeft, P, P, "topLeft");
		checkBlock(topRight, P, Q, "topRight");
		checkBlock(bottomLeft, Q, P, "bottomLeft");
		checkBlock(bottomRight, Q, Q, "bottomRight");

		Matrix<R> C = new Matrix<R>("C", any.ring, n, n);
		scatter(C, topLeft, P, P);
		scatter(C, topRight, P, Q);
		scatter(C, bottomLeft, Q, P);
		scatter(C, bottomRight, Q, Q);
		return C;
	}

	private static void checkBlock(Matrix<?> B, IndexSubset rows, IndexSubset cols, String which) {
		if (B != null && (B.M != rows.size() || B.N != cols.size()))
			throw new InvalidInputException("BlockView.combine(): Block " + which + " is " + B.M + "x" + B.N
					+ ", expected " + rows.size() + "x" + cols.size() + ".");
	}

	// writes block B into C at the rows & columns listed by the subsets, the subsets never overlap between calls
	private static <R> void scatter(Matrix<R> C, Matrix<R> B, IndexSubset rows, IndexSubset cols) {
		if (B == null) return;
		for (int r = 0, rN = 0; r < B.M; r++, rN += B.N) {
			int iN = rows.indexAt(r) * C.N;
			for (int c = 0; c < B.N; c++)
				C.data[iN + cols.indexAt(c)] = B.data[rN + c];
		}
	}


	// symmetric reindexing: result(i,j) = A(perm[i], perm[j]); perm must be a permutation of 0..n-1
	public static <R> Matrix<R> reindex(Matrix<R> A, int[] perm) {

		if (!A.isSquare() || perm.length != A.M)
			throw new InvalidInputException("BlockView.reindex(): Permutation does not match matrix dimensions.");
		boolean[] seen = new boolean[perm.length];
		for (int p : perm) {
			if (p < 0 || p >= perm.length || seen[p]) throw new InvalidInputException("BlockView.reindex(): Not a permutation.");
			seen[p] = true;
		}

		Matrix<R> B = new Matrix<R>(Matrix.DEBUG_LEVEL > 1 ? A.name + "^P" : "P", A.ring, A.M, A.N);
		for (int i = 0; i < A.M; i++) {
			int iN = i * A.N, pN = perm[i] * A.N;
			for (int j = 0; j < A.N; j++) B.data[iN + j] = A.data[pN + perm[j]];
		}
		return B;
	}
}
