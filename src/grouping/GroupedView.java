package grouping;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import config.LoggingConfig;
import data.ColumnData;
import data.Dataset;
import data.Relation;

/**
 * A dataset together with grouping keys. Group labels and
 * the group index are built either on creation or on first
 * access, and reused until keys, policy or dataset change.
 * The wrapped dataset is never copied or modified.
 *
 * @author immanueltrummer
 *
 */
public class GroupedView implements Dataset {
	/**
	 * The grouped dataset.
	 */
	Dataset dataset;
	/**
	 * Grouping keys, in order of significance.
	 */
	ImmutableList<GroupKey> keys;
	/**
	 * Whether groups without rows are dropped.
	 */
	DropPolicy policy;
	/**
	 * Current lifecycle state.
	 */
	ViewState state;
	/**
	 * Key values of each group, null unless materialized.
	 */
	LabelTable labels;
	/**
	 * Rows of each group, null unless materialized.
	 */
	GroupIndex index;
	/**
	 * Number of dataset rows when index was built.
	 */
	int indexedRows;
	/**
	 * Initializes lazy view after verifying that keys resolve.
	 *
	 * @param dataset	dataset to group
	 * @param keys		grouping keys
	 * @param policy	whether groups without rows are dropped
	 * @throws UnknownKeyException	if a key column does not exist
	 */
	GroupedView(Dataset dataset, List<GroupKey> keys,
			DropPolicy policy) throws UnknownKeyException {
		checkKeys(dataset, keys);
		this.dataset = dataset;
		this.keys = ImmutableList.copyOf(keys);
		this.policy = policy;
		this.state = ViewState.LAZY;
	}
	/**
	 * Groups rows of the given dataset by the given keys.
	 *
	 * @param dataset	dataset to group
	 * @param keys		at least one grouping key
	 * @param policy	whether groups without rows are dropped
	 * @param lazy		whether to defer building the index
	 * @return			new grouped view
	 * @throws GroupingException	if keys do not resolve or (for eager
	 * 								views) the index cannot be built
	 */
	public static GroupedView build(Dataset dataset, List<GroupKey> keys,
			DropPolicy policy, boolean lazy) throws GroupingException {
		GroupedView view = new GroupedView(dataset, keys, policy);
		if (!lazy) {
			view.materialize();
		}
		return view;
	}
	/**
	 * Verifies that at least one key is given and that
	 * all key columns exist in the dataset.
	 *
	 * @param dataset	dataset to group
	 * @param keys		grouping keys
	 * @throws UnknownKeyException	if a key column does not exist
	 */
	static void checkKeys(Dataset dataset, List<GroupKey> keys)
			throws UnknownKeyException {
		if (keys.isEmpty()) {
			throw new IllegalArgumentException(
					"Error - grouped view requires at least one key");
		}
		for (GroupKey key : keys) {
			key.validate(dataset);
		}
	}
	/**
	 * Whether labels and index are still to be built.
	 *
	 * @return	true iff the view is lazy
	 */
	public boolean isLazy() {
		checkGrouped();
		return state == ViewState.LAZY;
	}
	/**
	 * Returns the current lifecycle state.
	 *
	 * @return	view state
	 */
	public ViewState getState() {
		return state;
	}
	/**
	 * Builds labels and index unless already done. If the view
	 * is materialized, verifies that the index is up to date.
	 *
	 * @throws GroupingException	if the index cannot be built or
	 * 								does not match the dataset
	 */
	public void materialize() throws GroupingException {
		checkGrouped();
		if (state == ViewState.MATERIALIZED) {
			checkFresh();
		} else {
			buildIndex();
		}
	}
	/**
	 * Discards labels and index and builds them for the
	 * current content of the dataset. On failure, the
	 * view remains unchanged.
	 *
	 * @throws GroupingException	if the index cannot be built
	 */
	public void rebuild() throws GroupingException {
		checkGrouped();
		buildIndex();
	}
	/**
	 * Runs ID assignment, label and index construction
	 * and stores results only if all steps succeed.
	 *
	 * @throws GroupingException	if the index cannot be built
	 */
	void buildIndex() throws GroupingException {
		int cardinality = dataset.getCardinality();
		List<String> keyNames = getGroups();
		List<ColumnData> keyCols = new ArrayList<>(keys.size());
		for (GroupKey key : keys) {
			keyCols.add(key.resolve(dataset));
		}
		GroupIds groupIds = IdAssigner.assign(
				keyNames, keyCols, cardinality, policy);
		LabelTable newLabels = LabelBuilder.build(keyNames, keyCols, groupIds);
		GroupIndex newIndex = IndexBuilder.build(groupIds);
		labels = newLabels;
		index = newIndex;
		indexedRows = cardinality;
		state = ViewState.MATERIALIZED;
		if (cardinality == 0) {
			log("Grouped empty dataset by " + keyNames);
		}
		log("Materialized " + newIndex.nrGroups + " groups over " +
				cardinality + " rows");
	}
	/**
	 * Throws an exception if the dataset row count changed
	 * since the index was built.
	 *
	 * @throws StaleIndexException	if the index is outdated
	 */
	void checkFresh() throws StaleIndexException {
		int currentRows = dataset.getCardinality();
		if (currentRows != indexedRows) {
			throw new StaleIndexException(indexedRows, currentRows);
		}
	}
	/**
	 * Returns the number of groups.
	 *
	 * @return	number of groups
	 * @throws GroupingException	if the index cannot be built
	 */
	public int groupCount() throws GroupingException {
		materialize();
		return labels.nrGroups;
	}
	/**
	 * Returns the number of rows in each group.
	 *
	 * @return	group sizes in group order
	 * @throws GroupingException	if the index cannot be built
	 */
	public int[] groupSizes() throws GroupingException {
		materialize();
		return index.groupSizes();
	}
	/**
	 * Returns key values of each group.
	 *
	 * @return	label table
	 * @throws GroupingException	if the index cannot be built
	 */
	public LabelTable labels() throws GroupingException {
		materialize();
		return labels;
	}
	/**
	 * Returns rows of each group.
	 *
	 * @return	group index
	 * @throws GroupingException	if the index cannot be built
	 */
	public GroupIndex index() throws GroupingException {
		materialize();
		return index;
	}
	/**
	 * Returns positions of the rows in one group.
	 *
	 * @param groupID	ID of group
	 * @return			ascending row positions
	 * @throws GroupingException	if the index cannot be built
	 */
	public int[] groupRows(int groupID) throws GroupingException {
		materialize();
		return index.getRows(groupID);
	}
	/**
	 * Copies all columns of the rows in one group
	 * into a new relation.
	 *
	 * @param groupID	ID of group
	 * @return			relation containing group rows
	 * @throws GroupingException	if the index cannot be built
	 */
	public Relation groupData(int groupID) throws GroupingException {
		int[] rows = groupRows(groupID);
		return Relation.copyRows(dataset, "group" + groupID, rows);
	}
	/**
	 * Returns names of grouping keys.
	 *
	 * @return	ordered key names
	 */
	public List<String> getGroups() {
		List<String> keyNames = new ArrayList<>(keys.size());
		for (GroupKey key : keys) {
			keyNames.add(key.name);
		}
		return keyNames;
	}
	/**
	 * Returns the grouped dataset.
	 *
	 * @return	wrapped dataset
	 */
	public Dataset getDataset() {
		return dataset;
	}
	/**
	 * Returns grouping keys.
	 *
	 * @return	ordered keys
	 */
	public List<GroupKey> getKeys() {
		return keys;
	}
	/**
	 * Returns the drop policy.
	 *
	 * @return	whether groups without rows are dropped
	 */
	public DropPolicy getDropPolicy() {
		return policy;
	}
	/**
	 * Replaces grouping keys, the view becomes lazy.
	 *
	 * @param newKeys	new grouping keys
	 * @throws UnknownKeyException	if a key column does not exist
	 */
	public void setKeys(List<GroupKey> newKeys) throws UnknownKeyException {
		checkGrouped();
		checkKeys(dataset, newKeys);
		keys = ImmutableList.copyOf(newKeys);
		invalidate();
	}
	/**
	 * Replaces drop policy, the view becomes lazy
	 * if the policy changes.
	 *
	 * @param newPolicy	new drop policy
	 */
	public void setDropPolicy(DropPolicy newPolicy) {
		checkGrouped();
		if (newPolicy != policy) {
			policy = newPolicy;
			invalidate();
		}
	}
	/**
	 * Replaces the grouped dataset, the view becomes lazy.
	 *
	 * @param newDataset	dataset to group
	 * @throws UnknownKeyException	if a key column does not exist
	 */
	public void setDataset(Dataset newDataset) throws UnknownKeyException {
		checkGrouped();
		checkKeys(newDataset, keys);
		dataset = newDataset;
		invalidate();
	}
	/**
	 * Removes grouping and returns the unmodified dataset.
	 * Has no further effect if the view was ungrouped before.
	 *
	 * @return	the wrapped dataset
	 */
	public Dataset ungroup() {
		if (state != ViewState.UNGROUPED) {
			log("Ungrouped view on " + getGroups());
		}
		keys = ImmutableList.of();
		policy = null;
		labels = null;
		index = null;
		state = ViewState.UNGROUPED;
		return dataset;
	}
	/**
	 * Whether the grouped dataset has no rows.
	 *
	 * @return	true iff dataset is empty
	 */
	public boolean isEmptyDataset() {
		return dataset.getCardinality() == 0;
	}
	/**
	 * Discards labels and index.
	 */
	void invalidate() {
		labels = null;
		index = null;
		state = ViewState.LAZY;
		log("View on " + getGroups() + " is lazy");
	}

	void checkGrouped() {
		if (state == ViewState.UNGROUPED) {
			throw new IllegalStateException("Error - view was ungrouped");
		}
	}

	@Override
	public int getCardinality() {
		return dataset.getCardinality();
	}

	@Override
	public ColumnData getColumn(String columnName) {
		return dataset.getColumn(columnName);
	}

	@Override
	public List<String> getColumnNames() {
		return dataset.getColumnNames();
	}

	@Override
	public String toString() {
		return "Groups: " + StringUtils.join(getGroups(), ", ");
	}
	/**
	 * Output given log text if activated.
	 *
	 * @param logText	text to log if activated
	 */
	static void log(String logText) {
		if (LoggingConfig.VIEW_VERBOSE) {
			System.out.println(logText);
		}
	}
}
