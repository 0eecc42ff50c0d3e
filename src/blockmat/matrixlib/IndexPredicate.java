package blockmat.matrixlib;

// Boolean selector over matrix indexes, the way a block is specified to the block view
public interface IndexPredicate {

	boolean test(int i);
}
