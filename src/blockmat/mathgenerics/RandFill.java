package blockmat.mathgenerics;

import java.util.Random;

// RandFill is supplied with an integer range [startRange, endRange) and returns random values within it,
// never the same value twice, so repeated calls populate the range evenly with random slots.
// Used for scattering a chosen number of nonzero entries into the free cells of a generated matrix.
// "sectors" holds integer pairs: start and end offset of a still unoccupied run of slots.
// There is always at least one occupied slot between two sectors, every new occupied slot can split a sector.
public class RandFill {
	private int sectorCnt = 1, slotCount, startRange, endRange;
	private int[] sectors;
	private final Random rnd;

	public RandFill(int startRange, int endRange, Random rnd) {
		if (startRange >= endRange) throw new IllegalArgumentException("RandFill(): Invalid range.");
		this.startRange = startRange;
		this.endRange = endRange;
		this.rnd = rnd;
		slotCount = endRange - startRange;
		sectors = new int[slotCount * 2 + 2];		// worst case: every other slot occupied
		sectors[1] = slotCount - 1;					// the first sector covers the entire range
	}

	public RandFill(int range, Random rnd) { this(0, range, rnd); }

	public int remainingSlots() { return slotCount; }

	// returns -1 once every slot of the range has been handed out
	public int getRandom() {

		if (sectorCnt == 0) return -1;

		int rndSec = rnd.nextInt(sectorCnt) * 2;					// select a random sector
		int secLen = sectors[rndSec + 1] - sectors[rndSec] + 1;
		int slot;

		// single-slot sector gets deleted by copying the last sector over it
		if (secLen == 1) {
			sectorCnt--;
			slotCount--;
			slot = sectors[rndSec];
			sectors[rndSec] = sectors[sectorCnt * 2];
			sectors[rndSec + 1] = sectors[sectorCnt * 2 + 1];
			return startRange + slot;
		}
		slot = rnd.nextInt(secLen) + sectors[rndSec];
		if (slot == sectors[rndSec])			sectors[rndSec]++;			// slot at start of sector
		else if (slot == sectors[rndSec + 1])	sectors[rndSec + 1]--;		// slot at end of sector
		else {																// slot in middle, split into two sectors
			sectors[sectorCnt * 2] = slot + 1;
			sectors[sectorCnt * 2 + 1] = sectors[rndSec + 1];
			sectors[rndSec + 1] = slot - 1;
			sectorCnt++;
		}
		slotCount--;
		return startRange + slot;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("Range: " + startRange + "-" + endRange + "\n");
		sb.append("Sectors: ");
		for (int s = 0, s2 = 0; s < sectorCnt; s++)
			sb.append("[" + (sectors[s2++] + startRange) + "-" + (sectors[s2++] + startRange) + "]");
		return sb.toString();
	}
}
