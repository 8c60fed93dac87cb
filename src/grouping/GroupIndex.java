package grouping;

import java.util.Arrays;

/**
 * Maps each group ID to the ascending positions of the rows
 * in that group. Positions of all groups are stored in one
 * array, ordered by group ID.
 *
 * @author immanueltrummer
 *
 */
public class GroupIndex {
	/**
	 * Rows of group i are found at positions from
	 * offsets[i] (inclusive) to offsets[i+1] (exclusive).
	 */
	final int[] offsets;
	/**
	 * Row positions, ordered by group ID and row.
	 */
	final int[] positions;
	/**
	 * Number of groups.
	 */
	public final int nrGroups;
	/**
	 * Initializes index from offsets and row positions.
	 *
	 * @param offsets	start of each group (and end of last)
	 * @param positions	row positions ordered by group
	 */
	GroupIndex(int[] offsets, int[] positions) {
		this.offsets = offsets;
		this.positions = positions;
		this.nrGroups = offsets.length - 1;
	}
	/**
	 * Returns the number of rows in given group.
	 *
	 * @param groupID	ID of group
	 * @return			number of rows with that group ID
	 */
	public int groupSize(int groupID) {
		checkGroup(groupID);
		return offsets[groupID + 1] - offsets[groupID];
	}
	/**
	 * Returns the number of rows for each group.
	 *
	 * @return	group sizes in group ID order
	 */
	public int[] groupSizes() {
		int[] sizes = new int[nrGroups];
		for (int groupID=0; groupID<nrGroups; ++groupID) {
			sizes[groupID] = offsets[groupID + 1] - offsets[groupID];
		}
		return sizes;
	}
	/**
	 * Returns positions of rows in given group.
	 *
	 * @param groupID	ID of group
	 * @return			ascending row positions
	 */
	public int[] getRows(int groupID) {
		checkGroup(groupID);
		return Arrays.copyOfRange(positions,
				offsets[groupID], offsets[groupID + 1]);
	}
	/**
	 * Returns the number of indexed rows.
	 *
	 * @return	number of rows over all groups
	 */
	public int getCardinality() {
		return positions.length;
	}

	void checkGroup(int groupID) {
		if (groupID < 0 || groupID >= nrGroups) {
			throw new IndexOutOfBoundsException("Error - no group " + groupID);
		}
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("[");
		for (int groupID=0; groupID<nrGroups; ++groupID) {
			if (groupID > 0) {
				builder.append(", ");
			}
			builder.append(Arrays.toString(getRows(groupID)));
		}
		return builder.append("]").toString();
	}
}
