package grouping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import data.ColumnData;
import data.Dataset;

/**
 * Key values of each group: row i holds the key-tuple
 * of the group with ID i, one column per key.
 *
 * @author immanueltrummer
 *
 */
public class LabelTable implements Dataset {
	/**
	 * Names of key columns, in key order.
	 */
	final List<String> keyNames;
	/**
	 * Data of key columns, in key order.
	 */
	final List<ColumnData> keyCols;
	/**
	 * Number of groups described by this table.
	 */
	public final int nrGroups;
	/**
	 * Initializes label table.
	 *
	 * @param keyNames	names of key columns
	 * @param keyCols	key values per group
	 * @param nrGroups	number of groups
	 */
	public LabelTable(List<String> keyNames,
			List<ColumnData> keyCols, int nrGroups) {
		this.keyNames = Collections.unmodifiableList(new ArrayList<>(keyNames));
		this.keyCols = Collections.unmodifiableList(new ArrayList<>(keyCols));
		this.nrGroups = nrGroups;
	}
	/**
	 * Creates label table without keys and groups.
	 *
	 * @return	empty label table
	 */
	public static LabelTable empty() {
		return new LabelTable(Collections.emptyList(),
				Collections.emptyList(), 0);
	}
	/**
	 * Returns the key values of one group.
	 *
	 * @param groupID	ID of group
	 * @return			key value for each key (null for NULL)
	 */
	public List<Object> getLabel(int groupID) {
		if (groupID < 0 || groupID >= nrGroups) {
			throw new IndexOutOfBoundsException("Error - no group " + groupID);
		}
		List<Object> label = new ArrayList<>(keyCols.size());
		for (ColumnData keyCol : keyCols) {
			label.add(keyCol.valueAt(groupID));
		}
		return label;
	}
	/**
	 * Returns the key values of all groups, in group order.
	 *
	 * @return	one label per group
	 */
	public List<List<Object>> getLabels() {
		List<List<Object>> labels = new ArrayList<>(nrGroups);
		for (int groupID=0; groupID<nrGroups; ++groupID) {
			labels.add(getLabel(groupID));
		}
		return labels;
	}
	/**
	 * Returns the number of key columns.
	 *
	 * @return	number of keys
	 */
	public int getNrKeys() {
		return keyCols.size();
	}

	@Override
	public int getCardinality() {
		return nrGroups;
	}

	@Override
	public ColumnData getColumn(String columnName) {
		int keyCtr = keyNames.indexOf(columnName);
		return keyCtr < 0 ? null : keyCols.get(keyCtr);
	}

	@Override
	public List<String> getColumnNames() {
		return keyNames;
	}

	@Override
	public String toString() {
		List<String> rows = new ArrayList<>(nrGroups);
		for (List<Object> label : getLabels()) {
			rows.add(StringUtils.join(label, "\t"));
		}
		return StringUtils.join(keyNames, "\t") + "\n" +
				StringUtils.join(rows, "\n");
	}
}
