package blockmat.matrixlib;

import blockmat.mathgenerics.Ring;


// Ordinary dense determinant and inverse of a single block, with no block structure known.
// Over a field the kernel eliminates (Gauss for the determinant, Gauss-Jordan for the inverse).
// Over a general commutative ring there is no division: small blocks use Laplace expansion and the
// cofactor adjugate, larger ones the division-free Berkowitz characteristic polynomial, O(n^4),
// with the adjugate taken from the polynomial through Cayley-Hamilton.
// An inverse over a ring exists only when the determinant is a unit, it is adj(A) scaled by det^-1.
public final class ScalarBlockKernel {

	// blocks up to this size take the Laplace/cofactor path over non-field rings
	public static int LAPLACE_LIMIT = 5;

	// counts recursive entries into the Laplace expansion, printed when DEBUG_LEVEL > 1
	static volatile int detL_DEBUG;

	private ScalarBlockKernel() {}

	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			DETERMINANT
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	public static <R> R det(Matrix<R> A) {
		if (!A.isSquare()) throw new InvalidInputException("ScalarBlockKernel.det(): Nonsquare matrix.");
		Ring<R> ring = A.ring;
		if (A.M == 0) return ring.one();					// empty product
		if (ring.isField()) return determinantGauss(A);
		if (A.M > LAPLACE_LIMIT) return determinantBerkowitz(A);
		detL_DEBUG = 0;
		R det = determinantLaplace(A);
		if (Matrix.DEBUG_LEVEL > 1) System.out.println("Laplace expansion of " + A.name + ", recursions: " + detL_DEBUG);
		return det;
	}


	// Gauss elimination on a copy of the data field, pivoting on the first nonzero element of the column
	static <R> R determinantGauss(Matrix<R> A) {

		Ring<R> ring = A.ring;
		int N = A.N;
		R[] data = A.data.clone();
		R det = ring.one();

		for (int i = 0; i < N; i++) {
			int iN = i * N;

			int pivot = i;
			while (pivot < N && ring.isZero(data[pivot * N + i])) pivot++;
			if (pivot == N) return ring.zero();				// singular
			if (pivot != i) {
				swapRows(data, N, i, pivot);
				det = ring.negate(det);						// determinant changes sign by row swapping
			}

			R iival = data[iN + i];
			det = ring.multiply(det, iival);
			R inv = ring.inverse(iival);
			for (int j = i + 1; j < N; j++) {
				int jN = j * N;
				if (ring.isZero(data[jN + i])) continue;
				R p = ring.multiply(data[jN + i], inv);
				for (int k = i + 1; k < N; k++)
					data[jN + k] = ring.subtract(data[jN + k], ring.multiply(data[iN + k], p));
				data[jN + i] = ring.zero();
			}
		}
		return det;
	}


	// Laplace expansion with row-column elimination, recursing along the row with the most zeros
	static <R> R determinantLaplace(Matrix<R> A) {

		detL_DEBUG++;
		Ring<R> ring = A.ring;
		R[] data = A.data;
		int N = A.N;

		// base cases solve directly, end of recursion
		if (N == 1) return data[0];
		if (N == 2) return ring.subtract(ring.multiply(data[0], data[3]), ring.multiply(data[1], data[2]));

		// find the sparsest row, a zero row means zero determinant
		int bestRow = 0, bestZeros = -1;
		for (int r = 0; r < N; r++) {
			int zeros = 0;
			for (int c = 0, rN = r * N; c < N; c++) if (ring.isZero(data[rN + c])) zeros++;
			if (zeros == N) return ring.zero();
			if (zeros > bestZeros) { bestZeros = zeros; bestRow = r; }
		}

		R det = ring.zero();
		for (int j = 0, rN = bestRow * N; j < N; j++) {
			R v = data[rN + j];
			if (ring.isZero(v)) continue;					// this test makes sparse matrices fast to expand
			R term = ring.multiply(v, determinantLaplace(A.eliminateRowColumn(bestRow, j)));
			det = ((bestRow + j) & 1) == 0 ? ring.add(det, term) : ring.subtract(det, term);
		}
		return det;
	}


	// det(A) = (-1)^n * c(n), c being the characteristic polynomial coefficients of A
	static <R> R determinantBerkowitz(Matrix<R> A) {
		R[] c = characteristicPolynomial(A);
		return (A.N & 1) == 0 ? c[A.N] : A.ring.negate(c[A.N]);
	}


	// Berkowitz algorithm, division free, valid over any commutative ring.
	// Returns c(0)..c(n) with det(xI - A) = c(0)x^n + c(1)x^(n-1) + ... + c(n), c(0) = 1.
	// Leading principal blocks grow one row & column at a time: with A(k+1) = | A(k) C |, a = A(k,k),
	//																		  | R    a |
	// the polynomial of A(k+1) is the lower triangular Toeplitz matrix with first column
	// 1, -a, -R.C, -R.A(k).C, ..., -R.A(k)^(k-1).C applied to the polynomial of A(k)
	static <R> R[] characteristicPolynomial(Matrix<R> A) {

		Ring<R> ring = A.ring;
		R[] data = A.data;
		int N = A.N;
		R[] poly = ring.newArray(N + 1);
		poly[0] = ring.one();
		if (N == 0) return poly;
		poly[1] = ring.negate(data[0]);

		R[] col = ring.newArray(N + 1), v = ring.newArray(N), w = ring.newArray(N), next = ring.newArray(N + 1);
		for (int k = 1; k < N; k++) {
			int kN = k * N;

			// Toeplitz column
			col[0] = ring.one();
			col[1] = ring.negate(data[kN + k]);
			for (int i = 0; i < k; i++) v[i] = data[i * N + k];			// v = C
			for (int j = 0; j < k; j++) {
				R s = ring.zero();
				for (int i = 0; i < k; i++) s = ring.add(s, ring.multiply(data[kN + i], v[i]));
				col[j + 2] = ring.negate(s);
				if (j == k - 1) break;
				for (int i = 0; i < k; i++) {								// v = A(k).v
					R t = ring.zero();
					for (int l = 0, iN = i * N; l < k; l++) t = ring.add(t, ring.multiply(data[iN + l], v[l]));
					w[i] = t;
				}
				R[] temp = v; v = w; w = temp;
			}

			// Toeplitz product with the polynomial of A(k), k + 1 coefficients in, k + 2 out
			for (int r = 0; r <= k + 1; r++) {
				R s = ring.zero();
				for (int c = 0, cEnd = Math.min(r, k); c <= cEnd; c++)
					s = ring.add(s, ring.multiply(col[r - c], poly[c]));
				next[r] = s;
			}
			for (int r = 0; r <= k + 1; r++) poly[r] = next[r];
		}

		if (Matrix.DEBUG_LEVEL > 2) {
			StringBuilder sb = new StringBuilder("characteristic polynomial of " + A.name + ":");
			for (R c : poly) sb.append(" " + ring.format(c));
			System.out.println(sb.toString());
		}
		return poly;
	}


	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			INVERSE
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	// returns the inverse, or null if the matrix is singular (its determinant is not a unit of the ring)
	public static <R> Matrix<R> inverse(Matrix<R> A) {
		if (!A.isSquare()) throw new InvalidInputException("ScalarBlockKernel.inverse(): Nonsquare matrix.");
		if (A.M == 0) return new Matrix<R>("I", A.ring, 0, 0);
		if (A.ring.isField()) return inverseGaussJordan(A);
		return inverseAdjugate(A);
	}

	public static <R> Matrix<R> inverseOrThrow(Matrix<R> A) {
		Matrix<R> Ai = inverse(A);
		if (Ai == null)
			throw new SingularMatrixException("ScalarBlockKernel.inverse(): Matrix " + A.name + " (" + A.M + "x" + A.N
					+ ") is singular over " + A.ring.name() + ".");
		return Ai;
	}


	// Gauss-Jordan elimination of A alongside an identity matrix that turns into the inverse
	static <R> Matrix<R> inverseGaussJordan(Matrix<R> A) {

		Ring<R> ring = A.ring;
		int N = A.N;
		R[] dataA = A.data.clone();
		Matrix<R> Ai = Matrix.identity(ring, N);
		Ai.name = Matrix.DEBUG_LEVEL > 1 ? A.name + "^-1" : "Ai";
		R[] dataAi = Ai.data;

		for (int r = 0; r < N; r++) {
			int rN = r * N;

			int rPivot = r;
			while (rPivot < N && ring.isZero(dataA[rPivot * N + r])) rPivot++;
			if (rPivot == N) return null;					// got a singular matrix, abort
			if (rPivot != r) {
				swapRows(dataA, N, r, rPivot);
				swapRows(dataAi, N, r, rPivot);
			}

			// unitise the pivot row
			R div = ring.inverse(dataA[rN + r]);
			for (int j = 0; j < N; j++) {
				dataA[rN + j] = ring.multiply(dataA[rN + j], div);
				dataAi[rN + j] = ring.multiply(dataAi[rN + j], div);
			}

			// subtract the pivot row from every other row, above and below
			for (int i = 0; i < N; i++) {
				int iN = i * N;
				R f = dataA[iN + r];
				if (i == r || ring.isZero(f)) continue;
				for (int j = 0; j < N; j++) {
					dataA[iN + j] = ring.subtract(dataA[iN + j], ring.multiply(f, dataA[rN + j]));
					dataAi[iN + j] = ring.subtract(dataAi[iN + j], ring.multiply(f, dataAi[rN + j]));
				}
			}
		}

		if (Matrix.DEBUG_LEVEL > 2) {
			System.out.println("Gauss-Jordan inverse:");
			System.out.println(Ai.toString());
		}
		return Ai;
	}


	// A^-1 = adj(A) / det(A), where adj(A)(j,i) = (-1)^(i+j) det(minor(i,j))
	static <R> Matrix<R> inverseAdjugate(Matrix<R> A) {

		Ring<R> ring = A.ring;
		int N = A.N;
		if (N > LAPLACE_LIMIT) return inverseCayleyHamilton(A);
		R detInv = ring.inverse(det(A));
		if (detInv == null) return null;					// determinant is not a unit

		Matrix<R> Ai = new Matrix<R>(Matrix.DEBUG_LEVEL > 1 ? A.name + "^-1" : "Ai", ring, N, N);
		if (N == 1) { Ai.data[0] = detInv; return Ai; }

		for (int i = 0; i < N; i++)
			for (int j = 0; j < N; j++) {
				R cof = determinantLaplace(A.eliminateRowColumn(i, j));
				if (((i + j) & 1) != 0) cof = ring.negate(cof);
				Ai.data[j * N + i] = ring.multiply(cof, detInv);
			}
		return Ai;
	}


	// Cayley-Hamilton: A^n + c(1)A^(n-1) + ... + c(n)I = 0, so with Q = A^(n-1) + c(1)A^(n-2) + ... + c(n-1)I
	// A.Q = -c(n)I and adj(A) = (-1)^(n+1) Q. Q is built by Horner steps Q = Q.A + c(i)I.
	static <R> Matrix<R> inverseCayleyHamilton(Matrix<R> A) {

		Ring<R> ring = A.ring;
		int N = A.N;
		R[] c = characteristicPolynomial(A);
		R det = (N & 1) == 0 ? c[N] : ring.negate(c[N]);
		R detInv = ring.inverse(det);
		if (detInv == null) return null;					// determinant is not a unit

		Matrix<R> Q = Matrix.identity(ring, N);
		for (int i = 1; i < N; i++) {
			Q = Q.multiply(A);
			for (int d = 0; d < N; d++) Q.data[d * N + d] = ring.add(Q.data[d * N + d], c[i]);
		}
		// (-1)^(n+1) folded into the scale factor
		Matrix<R> Ai = Q.multiply((N & 1) == 0 ? ring.negate(detInv) : detInv);
		Ai.name = Matrix.DEBUG_LEVEL > 1 ? A.name + "^-1" : "Ai";
		return Ai;
	}


	private static <R> void swapRows(R[] data, int N, int r1, int r2) {
		for (int i = 0, or1 = r1 * N, or2 = r2 * N; i < N; i++, or1++, or2++) {
			R temp = data[or1]; data[or1] = data[or2]; data[or2] = temp;
		}
	}
}
