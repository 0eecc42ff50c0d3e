package blockmat.matrixlib;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;


// Labelling backed by an explicit list of labels, one per index
public final class ArrayLabelling<L extends Comparable<? super L>> implements Labelling<L> {

	private final List<L> labels;

	private ArrayLabelling(List<L> labels) { this.labels = labels; }

	@SafeVarargs
	public static <L extends Comparable<? super L>> ArrayLabelling<L> of(L... labels) {
		return ofList(Arrays.asList(labels));
	}

	public static <L extends Comparable<? super L>> ArrayLabelling<L> ofList(List<L> labels) {
		for (int i = 0; i < labels.size(); i++)
			if (labels.get(i) == null) throw new InvalidInputException("ArrayLabelling.of(): Null label at index " + i + ".");
		return new ArrayLabelling<L>(new ArrayList<L>(labels));
	}

	public static ArrayLabelling<Integer> ofInts(int... labels) {
		List<Integer> list = new ArrayList<Integer>(labels.length);
		for (int l : labels) list.add(l);
		return new ArrayLabelling<Integer>(list);
	}

	// materialises the first n labels of any labelling
	public static <L extends Comparable<? super L>> ArrayLabelling<L> copyOf(Labelling<L> b, int n) {
		List<L> list = new ArrayList<L>(n);
		for (int i = 0; i < n; i++) {
			L l = b.labelOf(i);
			if (l == null) throw new InvalidInputException("ArrayLabelling.copyOf(): Null label at index " + i + ".");
			list.add(l);
		}
		return new ArrayLabelling<L>(list);
	}

	// labelling of the reindexed matrix BlockView.reindex(A, perm): index i carries the label of perm[i]
	public ArrayLabelling<L> permute(int[] perm) {
		if (perm.length != labels.size()) throw new InvalidInputException("ArrayLabelling.permute(): Permutation length mismatch.");
		List<L> list = new ArrayList<L>(perm.length);
		for (int p : perm) list.add(labels.get(p));
		return new ArrayLabelling<L>(list);
	}

	public int size() { return labels.size(); }

	@Override
	public L labelOf(int i) { return labels.get(i); }

	@Override
	public String toString() { return labels.toString(); }
}
