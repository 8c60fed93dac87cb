package grouping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import data.ColumnData;

/**
 * Builds the table of key values describing each group,
 * ordered by group ID.
 *
 * @author immanueltrummer
 *
 */
public class LabelBuilder {
	/**
	 * Produces labels for the given group IDs.
	 *
	 * @param keyNames	names of key columns
	 * @param keyCols	data of key columns
	 * @param groupIds	group IDs calculated for the key columns
	 * @return			one label per group ID
	 */
	public static LabelTable build(List<String> keyNames,
			List<ColumnData> keyCols, GroupIds groupIds) {
		if (keyCols.isEmpty()) {
			return LabelTable.empty();
		}
		List<ColumnData> labelCols = groupIds.policy ==
				DropPolicy.FULL_CROSS_PRODUCT ?
						crossProductLabels(groupIds) :
						observedLabels(keyCols, groupIds);
		return new LabelTable(keyNames, labelCols, groupIds.nrGroups);
	}
	/**
	 * Copies key values of the first row of each group.
	 *
	 * @param keyCols	data of key columns
	 * @param groupIds	dense IDs of observed key-tuples
	 * @return			label columns
	 */
	static List<ColumnData> observedLabels(List<ColumnData> keyCols,
			GroupIds groupIds) {
		int[] representatives = representativeRows(groupIds);
		List<ColumnData> labelCols = new ArrayList<>(keyCols.size());
		for (ColumnData keyCol : keyCols) {
			labelCols.add(keyCol.copyRows(representatives));
		}
		return labelCols;
	}
	/**
	 * Returns for each group ID the first row with that ID,
	 * or -1 for IDs without rows.
	 *
	 * @param groupIds	group IDs per row
	 * @return			representative row per group
	 */
	static int[] representativeRows(GroupIds groupIds) {
		int[] representatives = new int[groupIds.nrGroups];
		Arrays.fill(representatives, -1);
		int[] ids = groupIds.ids;
		for (int row=0; row<ids.length; ++row) {
			if (representatives[ids[row]] < 0) {
				representatives[ids[row]] = row;
			}
		}
		return representatives;
	}
	/**
	 * Enumerates all combinations of key codes, the first
	 * key varying slowest, and copies associated values.
	 *
	 * @param groupIds	group IDs with codes of each key
	 * @return			label columns
	 */
	static List<ColumnData> crossProductLabels(GroupIds groupIds) {
		List<KeyCodes> keyCodes = groupIds.keyCodes;
		int nrGroups = groupIds.nrGroups;
		List<ColumnData> labelCols = new ArrayList<>(keyCodes.size());
		// Number of consecutive groups sharing the same code
		int stride = nrGroups;
		for (KeyCodes codes : keyCodes) {
			stride = codes.nrCodes == 0 ? 0 : stride / codes.nrCodes;
			int[] codePerGroup = new int[nrGroups];
			for (int groupID=0; groupID<nrGroups; ++groupID) {
				codePerGroup[groupID] = (groupID / stride) % codes.nrCodes;
			}
			labelCols.add(codes.values.copyRows(codePerGroup));
		}
		return labelCols;
	}
}
