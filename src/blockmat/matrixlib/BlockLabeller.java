package blockmat.matrixlib;

import blockmat.mathgenerics.Ring;
import blockmat.mathgenerics.VisitBitArray;


// Finds the finest labelling under which a square matrix is block triangular as it stands, without permuting it.
// The matrix is read as a directed graph with an edge i -> j for every nonzero off-diagonal entry (i,j).
// Block triangularity demands b(i) <= b(j) along every edge, so every cycle must share one label:
// the blocks are the strongly connected components, numbered in topological order of the condensation.
// The components are found by an iterative Tarjan search with explicit stacks.
public final class BlockLabeller {

	private BlockLabeller() {}

	public static <R> Labelling<Integer> label(Matrix<R> A) { return ArrayLabelling.ofInts(labels(A)); }

	// label of every index, labels run from 0 to (number of blocks - 1)
	public static <R> int[] labels(Matrix<R> A) {

		BlockTriangular.checkSquare(A, "BlockLabeller.labels()");
		int n = A.M;
		int[][] edge = buildEdges(A);

		int[] index = new int[n], low = new int[n], comp = new int[n];
		for (int i = 0; i < n; i++) index[i] = -1;
		int[] sccStack = new int[n], vStack = new int[n], ePos = new int[n];
		VisitBitArray onStack = new VisitBitArray(n);
		int counter = 0, comps = 0, sp = 0;

		for (int s = 0; s < n; s++) {
			if (index[s] != -1) continue;

			int vp = 0;
			vStack[0] = s; ePos[0] = 0;
			index[s] = low[s] = counter++;
			sccStack[sp++] = s; onStack.visit(s);

			while (vp >= 0) {
				int v = vStack[vp];
				if (ePos[vp] < edge[v].length) {
					int w = edge[v][ePos[vp]++];
					if (index[w] == -1) {								// descend into unvisited vertex
						index[w] = low[w] = counter++;
						sccStack[sp++] = w; onStack.visit(w);
						vStack[++vp] = w; ePos[vp] = 0;
					} else if (onStack.visited(w) && index[w] < low[v])
						low[v] = index[w];
				} else {												// edges of v exhausted
					if (low[v] == index[v]) {							// v roots a component, pop it off
						int w;
						do {
							w = sccStack[--sp];
							onStack.unvisit(w);
							comp[w] = comps;
						} while (w != v);
						comps++;
					}
					if (--vp >= 0 && low[v] < low[vStack[vp]]) low[vStack[vp]] = low[v];
				}
			}
		}

		// Tarjan completes a component only after every component reachable from it,
		// so completion order is reverse topological: the first completed component gets the largest label
		int[] labels = new int[n];
		for (int i = 0; i < n; i++) labels[i] = comps - 1 - comp[i];

		if (Matrix.DEBUG_LEVEL > 1) System.out.println("BlockLabeller: " + comps + " blocks over " + n + " indexes");
		return labels;
	}

	// adjacency lists of the nonzero pattern, diagonal entries excluded
	private static <R> int[][] buildEdges(Matrix<R> A) {
		Ring<R> ring = A.ring;
		int n = A.M;
		int[][] edge = new int[n][];
		int[] buf = new int[n];
		for (int i = 0; i < n; i++) {
			int cnt = 0;
			for (int j = 0, iN = i * n; j < n; j++)
				if (j != i && !ring.isZero(A.data[iN + j])) buf[cnt++] = j;
			edge[i] = new int[cnt];
			System.arraycopy(buf, 0, edge[i], 0, cnt);
		}
		return edge;
	}
}
