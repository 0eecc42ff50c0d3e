package blockmat.matrixlib;

import java.util.Arrays;


// The indexes of 0..universe-1 that satisfy some predicate, in ascending order,
// together with the bijection between them and the plain range 0..size-1 of a block:
// indexAt(k) goes from block position to original index, positionOf(i) goes back (-1 if i is not in the subset)
public final class IndexSubset implements IndexPredicate {

	private final int universe;
	private final int[] index;
	private final int[] position;

	private IndexSubset(int universe, int[] index) {
		this.universe = universe;
		this.index = index;
		position = new int[universe];
		Arrays.fill(position, -1);
		for (int k = 0; k < index.length; k++) position[index[k]] = k;
	}

	public static IndexSubset of(int universe, IndexPredicate p) {
		if (universe < 0) throw new InvalidInputException("IndexSubset.of(): Negative universe size.");
		int[] idx = new int[universe];
		int cnt = 0;
		for (int i = 0; i < universe; i++) if (p.test(i)) idx[cnt++] = i;
		return new IndexSubset(universe, Arrays.copyOf(idx, cnt));
	}

	public static IndexSubset all(int universe) {
		int[] idx = new int[universe];
		for (int i = 0; i < universe; i++) idx[i] = i;
		return new IndexSubset(universe, idx);
	}

	public static IndexSubset ofIndexes(int universe, int... indexes) {
		int[] idx = indexes.clone();
		Arrays.sort(idx);
		for (int k = 0; k < idx.length; k++) {
			if (idx[k] < 0 || idx[k] >= universe)
				throw new InvalidInputException("IndexSubset.ofIndexes(): Index " + idx[k] + " outside 0.." + (universe - 1) + ".");
			if (k > 0 && idx[k] == idx[k - 1])
				throw new InvalidInputException("IndexSubset.ofIndexes(): Duplicate index " + idx[k] + ".");
		}
		return new IndexSubset(universe, idx);
	}

	public int universe() { return universe; }
	public int size() { return index.length; }
	public boolean isEmpty() { return index.length == 0; }
	public int indexAt(int k) { return index[k]; }
	public int positionOf(int i) { return position[i]; }
	public boolean contains(int i) { return i >= 0 && i < universe && position[i] >= 0; }
	public int[] toArray() { return index.clone(); }

	@Override
	public boolean test(int i) { return contains(i); }

	public IndexSubset complement() {
		int[] idx = new int[universe - index.length];
		for (int i = 0, cnt = 0; i < universe; i++) if (position[i] < 0) idx[cnt++] = i;
		return new IndexSubset(universe, idx);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof IndexSubset)) return false;
		IndexSubset s = (IndexSubset) o;
		return universe == s.universe && Arrays.equals(index, s.index);
	}

	@Override
	public int hashCode() { return 31 * universe + Arrays.hashCode(index); }

	@Override
	public String toString() { return Arrays.toString(index) + "/" + universe; }
}
