package data;

import java.util.BitSet;

/**
 * Represents data contained in one column, used either
 * as a table column or as a grouping key.
 *
 * @author immanueltrummer
 *
 */
public abstract class ColumnData {
	/**
	 * Cardinality of this column.
	 */
	public final int cardinality;
	/**
	 * I-th bit is set if the i-th row contains a NULL value.
	 */
	public final BitSet isNull;
	/**
	 * Initializes flags indicating NULL values.
	 *
	 * @param cardinality	number of rows in column
	 */
	public ColumnData(int cardinality) {
		this.cardinality = cardinality;
		this.isNull = new BitSet(cardinality);
	}
	/**
	 * Contains a negative number if the element in the first row
	 * is ordered before the element in the second row, 0 if both
	 * elements are equal, a positive number otherwise. NULL values
	 * are equal to each other and ordered after all other values.
	 *
	 * @param row1	index of first row
	 * @param row2	index of second row
	 * @return		comparison result
	 */
	public int compareRows(int row1, int row2) {
		boolean null1 = isNull.get(row1);
		boolean null2 = isNull.get(row2);
		if (null1 || null2) {
			return Boolean.compare(null1, null2);
		}
		return compareValues(row1, row2);
	}
	/**
	 * Compares two non-NULL elements.
	 *
	 * @param row1	index of first row
	 * @param row2	index of second row
	 * @return		comparison result
	 */
	protected abstract int compareValues(int row1, int row2);
	/**
	 * Returns the (boxed) value in the given row or
	 * null if the row contains a NULL value.
	 *
	 * @param row	row index
	 * @return		value or null
	 */
	public abstract Object valueAt(int row);
	/**
	 * Produces new column by copying rows with given indices
	 * (the same row may be copied multiple times). An index
	 * of -1 inserts a NULL value.
	 *
	 * @param rowsToCopy	indices of rows to copy
	 * @return				new column with copied rows
	 */
	public abstract ColumnData copyRows(int[] rowsToCopy);
	/**
	 * Produces new column by copying rows with indices
	 * given as a bit set.
	 *
	 * @param rowsToCopy	indices of rows to copy
	 * @return				new column with copied rows
	 */
	public ColumnData copyRows(BitSet rowsToCopy) {
		return copyRows(rowsToCopy.stream().toArray());
	}
}
