package blockmat.matrixlib;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;


// The partition of an index set 0..n-1 induced by a labelling: the sorted set of labels that actually occur,
// and the block predicates "label < k", "label = k", "label <= k" as index subsets.
// Labels compare through compareTo(), two labels comparing equal denote the same block.
public final class LabelPartition<L extends Comparable<? super L>> {

	private final List<L> indexLabels;			// label of every index, materialised once
	private final NavigableSet<L> labels;

	private LabelPartition(List<L> indexLabels) {
		this.indexLabels = indexLabels;
		TreeSet<L> set = new TreeSet<L>();
		for (L l : indexLabels) set.add(l);
		labels = Collections.unmodifiableNavigableSet(set);
	}

	public static <L extends Comparable<? super L>> LabelPartition<L> of(int n, Labelling<L> b) {
		if (n < 0) throw new InvalidInputException("LabelPartition.of(): Negative index set size.");
		if (b instanceof ArrayLabelling && ((ArrayLabelling<?>) b).size() != n)
			throw new InvalidInputException("LabelPartition.of(): Labelling covers " + ((ArrayLabelling<?>) b).size()
					+ " indexes, matrix has " + n + ".");
		List<L> list = new ArrayList<L>(n);
		for (int i = 0; i < n; i++) {
			L l = b.labelOf(i);
			if (l == null) throw new InvalidInputException("LabelPartition.of(): Null label at index " + i + ".");
			list.add(l);
		}
		return new LabelPartition<L>(list);
	}

	public int size() { return indexLabels.size(); }
	public L labelOf(int i) { return indexLabels.get(i); }

	// labels occurring, ascending
	public NavigableSet<L> labels() { return labels; }
	public int labelCount() { return labels.size(); }
	public boolean isEmpty() { return labels.isEmpty(); }

	public L maxLabel() {
		if (labels.isEmpty()) throw new EmptyDomainException("LabelPartition.maxLabel(): Empty index set has no labels.");
		return labels.last();
	}

	public L minLabel() {
		if (labels.isEmpty()) throw new EmptyDomainException("LabelPartition.minLabel(): Empty index set has no labels.");
		return labels.first();
	}

	// { i | b(i) < k }
	public IndexSubset prefixIndices(final L k) {
		return IndexSubset.of(size(), new IndexPredicate() {
			@Override public boolean test(int i) { return indexLabels.get(i).compareTo(k) < 0; }
		});
	}

	// { i | b(i) = k }
	public IndexSubset indicesAt(final L k) {
		return IndexSubset.of(size(), new IndexPredicate() {
			@Override public boolean test(int i) { return indexLabels.get(i).compareTo(k) == 0; }
		});
	}

	// { i | b(i) <= k }
	public IndexSubset indicesUpTo(final L k) {
		return IndexSubset.of(size(), new IndexPredicate() {
			@Override public boolean test(int i) { return indexLabels.get(i).compareTo(k) <= 0; }
		});
	}

	// { i | b(i) > k }
	public IndexSubset indicesAbove(final L k) {
		return IndexSubset.of(size(), new IndexPredicate() {
			@Override public boolean test(int i) { return indexLabels.get(i).compareTo(k) > 0; }
		});
	}

	// partition of the restricted labelling b|s, reindexed onto the block positions 0..s.size()-1
	public LabelPartition<L> restrict(IndexSubset s) {
		if (s.universe() != size()) throw new InvalidInputException("LabelPartition.restrict(): Subset universe mismatch.");
		List<L> list = new ArrayList<L>(s.size());
		for (int k = 0; k < s.size(); k++) list.add(indexLabels.get(s.indexAt(k)));
		return new LabelPartition<L>(list);
	}

	@Override
	public String toString() { return "labels " + labels + " over " + size() + " indexes"; }
}
