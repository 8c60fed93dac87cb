package grouping;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import data.ColumnData;
import data.FactorData;
import data.FactorLevels;
import data.IntData;
import data.Relation;
import data.StringData;

class GroupedViewTest {

	static final FactorLevels ABC = new FactorLevels("a", "b", "c");

	static final FactorLevels ABCD = new FactorLevels("a", "b", "c", "d");

	static Relation example(FactorLevels levels) {
		Relation relation = new Relation("example", 5);
		relation.addColumn("g", FactorData.of(levels, "a", "b", "a", "c", "b"));
		relation.addColumn("v", IntData.of(1, 2, 3, 4, 5));
		return relation;
	}

	static List<GroupKey> keys(String... columnNames) {
		GroupKey[] keys = new GroupKey[columnNames.length];
		for (int i=0; i<columnNames.length; ++i) {
			keys[i] = GroupKey.column(columnNames[i]);
		}
		return Arrays.asList(keys);
	}

	@Test
	void observedGroupsOfExample() throws Exception {
		GroupedView view = GroupedView.build(example(ABC), keys("g"),
				DropPolicy.OBSERVED_ONLY, true);
		assertEquals(3, view.groupCount());
		assertEquals(Arrays.asList(Arrays.asList("a"), Arrays.asList("b"),
				Arrays.asList("c")), view.labels().getLabels());
		assertEquals("[[0, 2], [1, 4], [3]]", view.index().toString());
		assertArrayEquals(new int[] {2, 2, 1}, view.groupSizes());
	}

	@Test
	void fullCrossProductKeepsUnobservedLevel() throws Exception {
		GroupedView view = GroupedView.build(example(ABCD), keys("g"),
				DropPolicy.FULL_CROSS_PRODUCT, true);
		assertEquals(4, view.groupCount());
		assertArrayEquals(new int[] {2, 2, 1, 0}, view.groupSizes());
		assertEquals(0, view.groupRows(3).length);
		assertEquals(Arrays.asList("d"), view.labels().getLabel(3));
	}

	@Test
	void lazyViewMaterializesOnFirstAccess() throws Exception {
		GroupedView lazy = GroupedView.build(example(ABC), keys("g"),
				DropPolicy.OBSERVED_ONLY, true);
		assertTrue(lazy.isLazy());
		assertEquals(ViewState.LAZY, lazy.getState());
		int[] sizes = lazy.groupSizes();
		assertFalse(lazy.isLazy());
		GroupedView eager = GroupedView.build(example(ABC), keys("g"),
				DropPolicy.OBSERVED_ONLY, false);
		assertFalse(eager.isLazy());
		assertArrayEquals(eager.groupSizes(), sizes);
		assertEquals(eager.labels().getLabels(), lazy.labels().getLabels());
		assertEquals(eager.index().toString(), lazy.index().toString());
	}

	@Test
	void materializedIndexIsReused() throws Exception {
		GroupedView view = GroupedView.build(example(ABC), keys("g"),
				DropPolicy.OBSERVED_ONLY, false);
		GroupIndex index = view.index();
		view.materialize();
		assertSame(index, view.index());
		assertSame(view.labels(), view.labels());
	}

	@Test
	void unknownKeyFailsEvenForLazyView() {
		UnknownKeyException e = assertThrows(UnknownKeyException.class,
				() -> GroupedView.build(example(ABC), keys("g", "missing"),
						DropPolicy.OBSERVED_ONLY, true));
		assertEquals("missing", e.keyName);
	}

	@Test
	void emptyKeyListIsRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> GroupedView.build(example(ABC), keys(),
						DropPolicy.OBSERVED_ONLY, true));
	}

	@Test
	void changedRowCountMakesIndexStale() throws Exception {
		Relation relation = example(ABC);
		GroupedView view = GroupedView.build(relation, keys("g"),
				DropPolicy.OBSERVED_ONLY, false);
		BitSet keep = new BitSet();
		keep.set(0, 3);
		relation.retainRows(keep);
		StaleIndexException e = assertThrows(StaleIndexException.class,
				() -> view.groupCount());
		assertEquals(5, e.indexedRows);
		assertEquals(3, e.currentRows);
		view.rebuild();
		assertEquals(2, view.groupCount());
		assertArrayEquals(new int[] {2, 1}, view.groupSizes());
	}

	@Test
	void failedRebuildKeepsPriorState() throws Exception {
		Relation relation = example(ABC);
		GroupKey fixed = GroupKey.derived("fixed",
				dataset -> IntData.of(1, 1, 2, 2, 3));
		GroupedView view = GroupedView.build(relation, Arrays.asList(fixed),
				DropPolicy.OBSERVED_ONLY, false);
		LabelTable labels = view.labels();
		BitSet keep = new BitSet();
		keep.set(0, 3);
		relation.retainRows(keep);
		assertThrows(ArityMismatchException.class, () -> view.rebuild());
		assertEquals(ViewState.MATERIALIZED, view.getState());
		assertSame(labels, view.labels);
	}

	@Test
	void failedMaterializationLeavesViewLazy() throws Exception {
		GroupKey tooShort = GroupKey.derived("short",
				dataset -> IntData.of(1, 2));
		GroupedView view = GroupedView.build(example(ABC),
				Arrays.asList(tooShort), DropPolicy.OBSERVED_ONLY, true);
		assertThrows(ArityMismatchException.class, () -> view.groupSizes());
		assertTrue(view.isLazy());
	}

	@Test
	void derivedKeyIsEvaluatedOnDataset() throws Exception {
		GroupKey parity = GroupKey.derived("parity", dataset -> {
			IntData values = (IntData)dataset.getColumn("v");
			IntData result = new IntData(values.cardinality);
			for (int row=0; row<values.cardinality; ++row) {
				result.data[row] = values.data[row] % 2;
			}
			return result;
		});
		GroupedView view = GroupedView.build(example(ABC), Arrays.asList(parity),
				DropPolicy.OBSERVED_ONLY, true);
		assertEquals("[[1, 3], [0, 2, 4]]", view.index().toString());
		assertEquals(Arrays.asList(0), view.labels().getLabel(0));
	}

	@Test
	void changingKeysPolicyOrDatasetMakesViewLazy() throws Exception {
		GroupedView view = GroupedView.build(example(ABCD), keys("g"),
				DropPolicy.OBSERVED_ONLY, false);
		view.setDropPolicy(DropPolicy.FULL_CROSS_PRODUCT);
		assertTrue(view.isLazy());
		assertEquals(4, view.groupCount());
		view.setKeys(keys("v"));
		assertTrue(view.isLazy());
		assertEquals(5, view.groupCount());
		view.setDataset(example(ABC));
		assertTrue(view.isLazy());
		assertThrows(UnknownKeyException.class,
				() -> view.setKeys(keys("unknown")));
	}

	@Test
	void groupDataCopiesGroupRows() throws Exception {
		GroupedView view = GroupedView.build(example(ABC), keys("g"),
				DropPolicy.OBSERVED_ONLY, true);
		Relation group = view.groupData(1);
		assertEquals(2, group.getCardinality());
		assertEquals(2, group.getColumn("v").valueAt(0));
		assertEquals(5, group.getColumn("v").valueAt(1));
	}

	@Test
	void ungroupReturnsWrappedDataset() throws Exception {
		Relation relation = example(ABC);
		GroupedView view = GroupedView.build(relation, keys("g"),
				DropPolicy.OBSERVED_ONLY, false);
		assertSame(relation, view.ungroup());
		assertEquals(ViewState.UNGROUPED, view.getState());
		assertTrue(view.getGroups().isEmpty());
		assertNull(view.getDropPolicy());
		assertSame(relation, view.ungroup());
		assertThrows(IllegalStateException.class, () -> view.isLazy());
		assertThrows(IllegalStateException.class, () -> view.groupCount());
		assertEquals(5, relation.getCardinality());
	}

	@Test
	void emptyDatasetIsLegal() throws Exception {
		FactorLevels levels = new FactorLevels("x", "y");
		Relation relation = new Relation("empty", 0);
		relation.addColumn("f", new FactorData(0, levels));
		relation.addColumn("n", new IntData(0));
		GroupedView observed = GroupedView.build(relation, keys("f", "n"),
				DropPolicy.OBSERVED_ONLY, false);
		assertTrue(observed.isEmptyDataset());
		assertEquals(0, observed.groupCount());
		GroupedView full = GroupedView.build(relation, keys("f"),
				DropPolicy.FULL_CROSS_PRODUCT, false);
		assertEquals(2, full.groupCount());
		assertArrayEquals(new int[] {0, 0}, full.groupSizes());
	}

	@Test
	void summaryNamesKeys() throws Exception {
		GroupedView view = GroupedView.build(example(ABC), keys("g", "v"),
				DropPolicy.OBSERVED_ONLY, true);
		assertEquals("Groups: g, v", view.toString());
		assertEquals(Arrays.asList("g", "v"), view.getColumnNames());
	}

	@Test
	void groupsPartitionRowsAndMatchLabels() throws Exception {
		Random random = new Random(42);
		int cardinality = 1000;
		FactorLevels levels = new FactorLevels("w", "x", "y", "z");
		IntData n = new IntData(cardinality);
		StringData s = new StringData(cardinality);
		FactorData f = new FactorData(cardinality, levels);
		Set<Integer> distinctN = new HashSet<>();
		Set<String> distinctS = new HashSet<>();
		for (int row=0; row<cardinality; ++row) {
			n.data[row] = random.nextInt(10);
			s.data[row] = "s" + random.nextInt(3);
			f.data[row] = random.nextInt(3);
			distinctN.add(n.data[row]);
			distinctS.add(s.data[row]);
		}
		Relation relation = new Relation("random", cardinality);
		relation.addColumn("n", n).addColumn("s", s).addColumn("f", f);
		for (DropPolicy policy : DropPolicy.values()) {
			GroupedView view = GroupedView.build(relation,
					keys("n", "s", "f"), policy, true);
			LabelTable labels = view.labels();
			boolean[] seen = new boolean[cardinality];
			int total = 0;
			for (int groupID=0; groupID<view.groupCount(); ++groupID) {
				List<Object> label = labels.getLabel(groupID);
				int prevRow = -1;
				for (int row : view.groupRows(groupID)) {
					assertTrue(row > prevRow);
					assertFalse(seen[row]);
					seen[row] = true;
					prevRow = row;
					assertEquals(label, Arrays.asList(n.valueAt(row),
							s.valueAt(row), f.valueAt(row)));
				}
				total += view.groupSizes()[groupID];
			}
			assertEquals(cardinality, total);
			if (policy == DropPolicy.FULL_CROSS_PRODUCT) {
				assertEquals(distinctN.size() * distinctS.size() * 4,
						view.groupCount());
			} else {
				assertEquals(distinctLabels(labels), view.groupCount());
			}
			GroupedView again = GroupedView.build(relation,
					keys("n", "s", "f"), policy, false);
			assertEquals(labels.getLabels(), again.labels().getLabels());
			assertEquals(view.index().toString(), again.index().toString());
		}
	}

	static int distinctLabels(LabelTable labels) {
		return new HashSet<>(labels.getLabels()).size();
	}

	@Test
	void columnsAreReadThroughView() throws Exception {
		Relation relation = example(ABC);
		GroupedView view = GroupedView.build(relation, keys("g"),
				DropPolicy.OBSERVED_ONLY, true);
		ColumnData v = view.getColumn("v");
		assertSame(relation.getColumn("v"), v);
		assertEquals(5, view.getCardinality());
	}
}
