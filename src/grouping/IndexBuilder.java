package grouping;

/**
 * Builds the mapping from group IDs to rows by counting
 * rows per group and placing each row into its group.
 *
 * @author immanueltrummer
 *
 */
public class IndexBuilder {
	/**
	 * Builds group index for the given row IDs. Rows
	 * within each group keep their original order.
	 *
	 * @param groupIds	group ID for each row
	 * @return			rows for each group ID
	 */
	public static GroupIndex build(GroupIds groupIds) {
		int[] ids = groupIds.ids;
		int nrGroups = groupIds.nrGroups;
		// Count rows per group
		int[] offsets = new int[nrGroups + 1];
		for (int groupID : ids) {
			++offsets[groupID + 1];
		}
		// Turn counts into start positions
		for (int groupID=0; groupID<nrGroups; ++groupID) {
			offsets[groupID + 1] += offsets[groupID];
		}
		// Place rows
		int[] nextPos = new int[nrGroups];
		System.arraycopy(offsets, 0, nextPos, 0, nrGroups);
		int[] positions = new int[ids.length];
		for (int row=0; row<ids.length; ++row) {
			positions[nextPos[ids[row]]++] = row;
		}
		return new GroupIndex(offsets, positions);
	}
}
