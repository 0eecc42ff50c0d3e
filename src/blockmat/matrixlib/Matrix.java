package blockmat.matrixlib;

import blockmat.mathgenerics.Ring;


// Dense row-column matrix over a commutative ring, stored as a flat row-major array.
// The block engines treat matrices as values: they read their inputs and build fresh results,
// valueTo() is there for assembling inputs and for the block view's scatter operations.
public class Matrix<R> {

	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			FIXED VALUES
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	public static int MAX_PRINTEXTENT = 20;		// rows & columns shown by toString()

	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			INSTANCE-LEVEL VALUES
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	protected String name;
	protected int M, N; 						// number of rows & columns, zero allowed (empty index set)
	protected R[] data;							// flat array, element (r,c) at r * N + c
	protected final Ring<R> ring;

	// global variables
	// DEBUG_LEVEL > 1 prints intermediate results of the matrix and block algorithms to the console
	public static int DEBUG_LEVEL = 1;
	protected volatile static int nameCount = 1;

	// zero matrix of given dimensions
	public Matrix(String name, Ring<R> ring, int r, int c) {
		this(name, ring, r, c, Type.Null);
	}

	public Matrix(String name, Ring<R> ring, int r, int c, Type type) {
		if (r < 0 || c < 0) throw new InvalidInputException("Matrix(): Illegal matrix dimensions.");
		if (type == Type.Identity && r != c) throw new InvalidInputException("Matrix(): Identity matrix must be square.");
		this.name = name + nameCount++;
		this.ring = ring;
		this.M = r;
		this.N = c;
		data = ring.newArray(r * c);
		R zero = ring.zero();
		for (int i = 0, MN = r * c; i < MN; i++) data[i] = zero;
		if (type == Type.Identity) {
			R one = ring.one();
			for (int i = 0; i < r; i++) data[i * c + i] = one;
		}
	}

	// instantiates a matrix with a provided dataset, cloning the dataset into this matrix
	public Matrix(String name, Ring<R> ring, int r, int c, R[] data) {
		if (r < 0 || c < 0 || data.length < r * c) throw new InvalidInputException("Matrix(): Illegal matrix dimensions.");
		this.name = name + nameCount++;
		this.ring = ring;
		this.M = r;
		this.N = c;
		this.data = ring.newArray(r * c);
		for (int i = 0, MN = r * c; i < MN; i++) {
			if (data[i] == null) throw new InvalidInputException("Matrix(): Null element at offset " + i + ".");
			this.data[i] = data[i];
		}
	}

	// builds a matrix from small integer rows, all rows must have equal length
	public static <R> Matrix<R> fromLongs(String name, Ring<R> ring, long[][] rows) {
		int r = rows.length, c = r == 0 ? 0 : rows[0].length;
		Matrix<R> A = new Matrix<R>(name, ring, r, c);
		for (int i = 0; i < r; i++) {
			if (rows[i].length != c) throw new InvalidInputException("Matrix.fromLongs(): Ragged row " + i + ".");
			for (int j = 0; j < c; j++) A.data[i * c + j] = ring.valueOf(rows[i][j]);
		}
		return A;
	}

	public static <R> Matrix<R> identity(Ring<R> ring, int s) { return new Matrix<R>("I", ring, s, s, Type.Identity); }

	public String getName() { return name; }
	public Ring<R> ring() { return ring; }
	public int rows() { return M; }
	public int cols() { return N; }
	public boolean isSquare() { return M == N; }
	public boolean isEmpty() { return M == 0 || N == 0; }

	public R valueOf(int r, int c) { return data[r * N + c]; }

	public void valueTo(int r, int c, R v) {
		if (v == null) throw new InvalidInputException("Matrix.valueTo(): Null element.");
		data[r * N + c] = v;
	}

	public boolean isZeroAt(int r, int c) { return ring.isZero(data[r * N + c]); }


	// copy with its own data array, elements are immutable and shared
	@Override
	public Matrix<R> clone() { return new Matrix<R>(DEBUG_LEVEL > 1 ? name + "c" : "C", ring, M, N, data); }


	// returns the matrix with row r and column c removed, the minor used by cofactor expansion
	public Matrix<R> eliminateRowColumn(int r, int c) {

		if (r < 0 || r > M - 1 || c < 0 || c > N - 1)
			throw new InvalidInputException("Matrix.eliminateRowColumn(): Row or column out of bounds.");

		String newname = DEBUG_LEVEL > 2 ? name + "(M-" + r + ",N-" + c + ")" : name;
		Matrix<R> A = new Matrix<R>(newname, ring, M - 1, N - 1);

		for (int i = 0, ii = 0; i < M; i++) {
			if (i != r) {
				int iiAN = ii * A.N, iN = i * N;
				for (int j = 0, jj = 0; j < N; j++)
					if (j != c) A.data[iiAN + jj++] = data[iN + j];
				ii++;
			}
		}
		return A;
	}


	public Matrix<R> transpose() {
		Matrix<R> T = new Matrix<R>(name + "^T", ring, N, M);
		for (int i = 0; i < M; i++) {
			int iN = i * N;
			for (int j = 0, jMi = i; j < N; j++, jMi += M)
				T.data[jMi] = data[iN + j];
		}
		return T;
	}


	public Matrix<R> add(Matrix<R> B) { return addSub(B, false); }
	public Matrix<R> subtract(Matrix<R> B) { return addSub(B, true); }

	// does A+B or A-B into a new matrix C
	public Matrix<R> addSub(Matrix<R> B, boolean subtract) {

		if (B.M != M || B.N != N) throw new InvalidInputException("Matrix.addSub(): Nonmatching matrix dimensions.");

		String newname = DEBUG_LEVEL > 1 ? "(" + name + (subtract ? "-" : "+") + B.name + ")" : "A";
		Matrix<R> C = new Matrix<R>(newname, ring, M, N);
		R[] dataA = data, dataB = B.data, dataC = C.data;

		if (subtract)	for (int i = 0, MN = M * N; i < MN; i++) dataC[i] = ring.subtract(dataA[i], dataB[i]);
		else			for (int i = 0, MN = M * N; i < MN; i++) dataC[i] = ring.add(dataA[i], dataB[i]);

		if (DEBUG_LEVEL > 2) System.out.println(C.toString());
		return C;
	}


	// matrix product AB = C
	public Matrix<R> multiply(Matrix<R> B) {

		int aM = M, aN = N, bN = B.N;
		if (aN != B.M) throw new InvalidInputException("Matrix.multiply(): Nonmatching matrix dimensions.");

		String newname = DEBUG_LEVEL > 1 ? "(" + name + "." + B.name + ")" : "P";
		Matrix<R> C = new Matrix<R>(newname, ring, aM, bN);
		R[] dataA = data, dataB = B.data, dataC = C.data;

		for (int i = 0; i < aM; i++) {
			int iN = i * aN, iCN = bN * i;
			for (int j = 0; j < aN; j++) {
				R v = dataA[iN + j];
				if (ring.isZero(v)) continue;							// skip zero multiplicands, block matrices are sparse
				for (int k1 = iCN, k2 = j * bN, k1End = iCN + bN; k1 < k1End; k1++, k2++)
					dataC[k1] = ring.add(dataC[k1], ring.multiply(v, dataB[k2]));
			}
		}

		if (DEBUG_LEVEL > 2) System.out.println(C.toString());
		return C;
	}


	// scales every element by v
	public Matrix<R> multiply(R v) {
		Matrix<R> C = new Matrix<R>(DEBUG_LEVEL > 1 ? "s*" + name : "S", ring, M, N);
		for (int i = 0, MN = M * N; i < MN; i++) C.data[i] = ring.multiply(v, data[i]);
		return C;
	}

	public Matrix<R> negate() { return multiply(ring.negate(ring.one())); }


	public boolean isZero() {
		for (int i = 0, MN = M * N; i < MN; i++) if (!ring.isZero(data[i])) return false;
		return true;
	}

	public boolean isIdentity() {
		if (M != N) return false;
		R one = ring.one();
		for (int i = 0; i < M; i++)
			for (int j = 0; j < N; j++) {
				R v = data[i * N + j];
				if (i == j ? !ring.equal(v, one) : !ring.isZero(v)) return false;
			}
		return true;
	}


	// element-wise comparison under the ring's equality, names are not compared
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Matrix)) return false;
		Matrix<?> B = (Matrix<?>) o;
		if (B.M != M || B.N != N || !ring.name().equals(B.ring.name())) return false;
		R[] dataB = (R[]) B.data;			// same ring name, same element type
		for (int i = 0, MN = M * N; i < MN; i++)
			if (!ring.equal(data[i], dataB[i])) return false;
		return true;
	}

	// only the shape participates, DoubleField equality is tolerance based
	@Override
	public int hashCode() { return 31 * M + N; }


	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			OUTPUT METHODS
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	@Override
	public String toString() {

		StringBuilder sb = new StringBuilder();
		int maxM = M > MAX_PRINTEXTENT ? MAX_PRINTEXTENT : M;
		int maxN = N > MAX_PRINTEXTENT ? MAX_PRINTEXTENT : N;

		// common cell width, so that columns line up
		int width = 3;
		for (int i = 0; i < maxM; i++)
			for (int j = 0; j < maxN; j++) {
				int w = ring.format(data[i * N + j]).length();
				if (w > width) width = w;
			}
		String cell = "%" + (width + 2) + "s";

		sb.append("matrix: " + name + " (" + M + "x" + N + " over " + ring.name() + ")");
		if (M == 0 || N == 0) return sb.append(" [empty]\n").toString();
		for (int i = 0; i < maxM; i++) {
			sb.append("\n|");
			for (int j = 0; j < maxN; j++) {
				R v = data[i * N + j];
				sb.append(String.format(cell, ring.isZero(v) ? "-" : ring.format(v)));
			}
			// if matrix was bigger than allowed printout bounds, indicate the continuation
			if (maxN < N) sb.append(i % 4 == 0 ? " ..." : "    ");
			sb.append(" |");
		}
		if (maxM < M) sb.append("\n|").append(String.format(cell, ".")).append(" ...");
		sb.append("\n");
		return sb.toString();
	}


	public enum Type {
		Null, Identity
	}
}
