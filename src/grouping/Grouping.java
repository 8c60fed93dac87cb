package grouping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import config.GroupingConfig;
import data.Dataset;

/**
 * Entry points for grouping datasets, applicable to
 * plain datasets and grouped views alike.
 *
 * @author immanueltrummer
 *
 */
public class Grouping {
	/**
	 * Groups dataset by given keys. Grouping a grouped view
	 * groups its underlying dataset and leaves the view
	 * unchanged. Without keys, the plain dataset is returned.
	 *
	 * @param dataset	dataset to group
	 * @param keys		grouping keys
	 * @param lazy		whether to defer building the index
	 * @param drop		whether groups without rows are dropped
	 * @return			grouped view or plain dataset
	 * @throws GroupingException	if keys do not resolve
	 */
	public static Dataset groupBy(Dataset dataset, List<GroupKey> keys,
			boolean lazy, boolean drop) throws GroupingException {
		Dataset plain = dataset instanceof GroupedView ?
				((GroupedView)dataset).getDataset() : dataset;
		if (keys.isEmpty()) {
			return plain;
		}
		return GroupedView.build(plain, keys, DropPolicy.fromDrop(drop), lazy);
	}
	/**
	 * Groups dataset by the given columns, using default settings.
	 *
	 * @param dataset		dataset to group
	 * @param columnNames	names of key columns
	 * @return				grouped view or plain dataset
	 * @throws GroupingException	if keys do not resolve
	 */
	public static Dataset groupBy(Dataset dataset, String... columnNames)
			throws GroupingException {
		List<GroupKey> keys = new ArrayList<>();
		for (String columnName : columnNames) {
			keys.add(GroupKey.column(columnName));
		}
		return groupBy(dataset, keys, GroupingConfig.DEFAULT_LAZY,
				GroupingConfig.DEFAULT_DROP);
	}
	/**
	 * Replaces the groups of a dataset and builds the index
	 * immediately.
	 *
	 * @param dataset	dataset to regroup
	 * @param keys		new grouping keys
	 * @return			grouped view or plain dataset
	 * @throws GroupingException	if the index cannot be built
	 */
	public static Dataset regroup(Dataset dataset, List<GroupKey> keys)
			throws GroupingException {
		boolean drop = isGrouped(dataset) ?
				((GroupedView)dataset).getDropPolicy() ==
				DropPolicy.OBSERVED_ONLY : GroupingConfig.DEFAULT_DROP;
		return groupBy(dataset, keys, false, drop);
	}
	/**
	 * Removes grouping; plain datasets are returned as is.
	 *
	 * @param dataset	grouped or plain dataset
	 * @return			plain dataset
	 */
	public static Dataset ungroup(Dataset dataset) {
		if (dataset instanceof GroupedView) {
			return ((GroupedView)dataset).ungroup();
		}
		return dataset;
	}
	/**
	 * Whether the dataset is a grouped view that was not ungrouped.
	 *
	 * @param dataset	dataset to check
	 * @return			true iff dataset is grouped
	 */
	public static boolean isGrouped(Dataset dataset) {
		return dataset instanceof GroupedView &&
				((GroupedView)dataset).getState() != ViewState.UNGROUPED;
	}
	/**
	 * Returns names of grouping keys.
	 *
	 * @param dataset	grouped or plain dataset
	 * @return			key names, empty for plain datasets
	 */
	public static List<String> groups(Dataset dataset) {
		if (isGrouped(dataset)) {
			return ((GroupedView)dataset).getGroups();
		}
		return Collections.emptyList();
	}
	/**
	 * Returns the number of rows in each group. A plain
	 * dataset forms a single group.
	 *
	 * @param dataset	grouped or plain dataset
	 * @return			group sizes in group order
	 * @throws GroupingException	if the index cannot be built
	 */
	public static int[] groupSize(Dataset dataset) throws GroupingException {
		if (isGrouped(dataset)) {
			return ((GroupedView)dataset).groupSizes();
		}
		return new int[] {dataset.getCardinality()};
	}
}
