package grouping;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import data.ColumnData;
import data.FactorData;
import data.FactorLevels;
import data.IntData;
import data.StringData;

class LabelBuilderTest {

	static LabelTable labels(List<String> names, List<ColumnData> keys,
			DropPolicy policy) throws Exception {
		GroupIds groupIds = IdAssigner.assign(names, keys,
				keys.get(0).cardinality, policy);
		return LabelBuilder.build(names, keys, groupIds);
	}

	@Test
	void observedLabelsFollowIdOrder() throws Exception {
		ColumnData x = IntData.of(3, 1, 3, 1, 2);
		ColumnData y = StringData.of("b", "a", "a", "a", "b");
		LabelTable table = labels(Arrays.asList("x", "y"),
				Arrays.asList(x, y), DropPolicy.OBSERVED_ONLY);
		assertEquals(4, table.nrGroups);
		assertEquals(Arrays.asList(
				Arrays.asList(1, "a"), Arrays.asList(2, "b"),
				Arrays.asList(3, "a"), Arrays.asList(3, "b")),
				table.getLabels());
		assertEquals(Arrays.asList("x", "y"), table.getColumnNames());
	}

	@Test
	void crossProductLabelsVaryFirstKeySlowest() throws Exception {
		ColumnData f1 = FactorData.of(new FactorLevels("x", "y"), "y", "x");
		ColumnData f2 = FactorData.of(new FactorLevels("p", "q", "r"), "p", "r");
		LabelTable table = labels(Arrays.asList("f1", "f2"),
				Arrays.asList(f1, f2), DropPolicy.FULL_CROSS_PRODUCT);
		assertEquals(Arrays.asList(
				Arrays.asList("x", "p"), Arrays.asList("x", "q"),
				Arrays.asList("x", "r"), Arrays.asList("y", "p"),
				Arrays.asList("y", "q"), Arrays.asList("y", "r")),
				table.getLabels());
	}

	@Test
	void crossProductUsesObservedValuesOfOtherKeys() throws Exception {
		ColumnData f = FactorData.of(new FactorLevels("lo", "hi"), "hi", "hi", "hi");
		ColumnData n = IntData.of(2, 1, 2);
		LabelTable table = labels(Arrays.asList("f", "n"),
				Arrays.asList(f, n), DropPolicy.FULL_CROSS_PRODUCT);
		assertEquals(Arrays.asList(
				Arrays.asList("lo", 1), Arrays.asList("lo", 2),
				Arrays.asList("hi", 1), Arrays.asList("hi", 2)),
				table.getLabels());
	}

	@Test
	void nullKeyValuesFormLastLabel() throws Exception {
		StringData s = StringData.of(null, "b", "a", null);
		LabelTable table = labels(Arrays.asList("s"),
				Arrays.asList(s), DropPolicy.OBSERVED_ONLY);
		assertEquals(Arrays.asList("a"), table.getLabel(0));
		assertEquals(Arrays.asList("b"), table.getLabel(1));
		assertEquals(Arrays.asList((Object)null), table.getLabel(2));
	}

	@Test
	void noKeysGiveEmptyTable() throws Exception {
		LabelTable table = LabelBuilder.build(Arrays.asList(), Arrays.asList(),
				new GroupIds(new int[0], 0, Arrays.asList(), DropPolicy.OBSERVED_ONLY));
		assertEquals(0, table.nrGroups);
		assertEquals(0, table.getNrKeys());
	}

	@Test
	void labelOfUnknownGroupIsRejected() throws Exception {
		LabelTable table = labels(Arrays.asList("x"),
				Arrays.asList(IntData.of(1, 1)), DropPolicy.OBSERVED_ONLY);
		assertThrows(IndexOutOfBoundsException.class, () -> table.getLabel(1));
	}
}
