package blockmat.mathgenerics;

// Compact visit flags for graph walks over matrix indexes.
// Remembers which 64-bit words were touched so that clearing a sparsely visited array is cheap.
public class VisitBitArray {

	private static final int MAX_RESETS = 6;

	private long[] array = null;
	private int[] resetStack = new int[MAX_RESETS + 1];
	private int bitSets = 0, resets = 0;

	public VisitBitArray(int items) {
		array = new long[bitSets = (items >> 6) + 1];
		resetStack[0] = -1;
	}

	public void clearVisits() {
		if (resets >= MAX_RESETS)	{ array = new long[bitSets]; }
		else						for (int i = 1; i <= resets; i++) array[resetStack[i]] = 0;
		resets = 0;
		resetStack[0] = -1;
	}

	public boolean visited(int i) { return (array[i >> 6] & (0x1L << (i & 63))) != 0; }

	public void visit(int i) {
		int iD64 = i >> 6;
		array[iD64] |= (0x1L << (i & 63));
		// eliminate duplicate resettings of the same field as the previous one
		if (resets < MAX_RESETS && resetStack[resets] != iD64)
			resetStack[++resets] = iD64;
	}

	// clears a single flag, the word stays registered for clearVisits()
	public void unvisit(int i) { array[i >> 6] &= ~(0x1L << (i & 63)); }

	public int count() {
		int c = 0;
		for (long w : array) c += Long.bitCount(w);
		return c;
	}
}
