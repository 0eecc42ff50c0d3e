package blockmat.matrixlib;

import java.util.Random;

import blockmat.mathgenerics.RandFill;
import blockmat.mathgenerics.Ring;


// Generates random block triangular test matrices over any ring.
// Entries are small integers mapped into the ring. Invertible diagonal blocks are built as a product
// of a unit lower and a unit upper triangular matrix, giving determinant 1 in every ring.
public final class RandomBlockTriangular {

	private RandomBlockTriangular() {}

	// random labels 0..labelCount-1 over n indexes, every label used at least once when n >= labelCount
	public static int[] randomLabels(int n, int labelCount, Random rnd) {
		if (labelCount < 1 || n < 0) throw new InvalidInputException("RandomBlockTriangular.randomLabels(): Invalid label count.");
		int[] labels = new int[n];
		if (n == 0) return labels;
		RandFill rfill = new RandFill(n, rnd);
		for (int a = 0; a < n; a++) {
			int slot = rfill.getRandom();
			labels[slot] = a < labelCount ? a : rnd.nextInt(labelCount);	// first labelCount slots take each label once
		}
		return labels;
	}


	// fill = fraction of the cells above the block diagonal (column label > row label) that receive a nonzero entry,
	// range = entries are drawn from -range..range, invertible = build unimodular diagonal blocks
	public static <R> Matrix<R> generate(String name, Ring<R> ring, int[] labels, double fill, int range,
			boolean invertible, Random rnd) {

		if (fill < 0 || fill > 1) throw new InvalidInputException("RandomBlockTriangular.generate(): Fill must lie within 0..1.");
		if (range < 1) throw new InvalidInputException("RandomBlockTriangular.generate(): Range must be positive.");

		int n = labels.length;
		Matrix<R> A = new Matrix<R>(name, ring, n, n);
		LabelPartition<Integer> part = LabelPartition.of(n, ArrayLabelling.ofInts(labels));

		// diagonal blocks
		for (Integer a : part.labels()) {
			IndexSubset s = part.indicesAt(a);
			Matrix<R> D = invertible ? unimodular(ring, s.size(), range, rnd) : randomDense(ring, s.size(), range, rnd);
			for (int r = 0; r < s.size(); r++)
				for (int c = 0; c < s.size(); c++)
					A.valueTo(s.indexAt(r), s.indexAt(c), D.valueOf(r, c));
		}

		// cross blocks above the block diagonal, scattered with RandFill over the list of free cells
		int[] freeCells = new int[n * n];
		int free = 0;
		for (int i = 0; i < n; i++)
			for (int j = 0; j < n; j++)
				if (labels[j] > labels[i]) freeCells[free++] = i * n + j;
		int fillCount = (int) Math.round(free * fill);
		if (fillCount > 0) {
			RandFill rfill = new RandFill(free, rnd);
			for (int k = 0; k < fillCount; k++) {
				int cell = freeCells[rfill.getRandom()];
				A.valueTo(cell / n, cell % n, nonzero(ring, range, rnd));
			}
		}

		if (Matrix.DEBUG_LEVEL > 1) System.out.println(A.toString());
		return A;
	}


	private static <R> Matrix<R> unimodular(Ring<R> ring, int s, int range, Random rnd) {
		Matrix<R> L = Matrix.identity(ring, s), U = Matrix.identity(ring, s);
		for (int i = 0; i < s; i++)
			for (int j = 0; j < i; j++) {
				L.valueTo(i, j, value(ring, range, rnd));
				U.valueTo(j, i, value(ring, range, rnd));
			}
		return L.multiply(U);
	}

	private static <R> Matrix<R> randomDense(Ring<R> ring, int s, int range, Random rnd) {
		Matrix<R> D = new Matrix<R>("D", ring, s, s);
		for (int i = 0; i < s; i++)
			for (int j = 0; j < s; j++) D.valueTo(i, j, value(ring, range, rnd));
		return D;
	}

	private static <R> R value(Ring<R> ring, int range, Random rnd) {
		return ring.valueOf(rnd.nextInt(2 * range + 1) - range);
	}

	// redraws while the value maps to zero, as it does for multiples of a small modulus
	private static <R> R nonzero(Ring<R> ring, int range, Random rnd) {
		R r;
		do {
			int v = rnd.nextInt(range) + 1;
			r = ring.valueOf(rnd.nextBoolean() ? v : -v);
		} while (ring.isZero(r));
		return r;
	}
}
