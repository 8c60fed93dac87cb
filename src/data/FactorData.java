package data;

/**
 * Represents content of a bounded-category column: each
 * row stores the code of one level of a fixed, ordered
 * set of levels. Rows are ordered by level order.
 *
 * @author immanueltrummer
 *
 */
public class FactorData extends ColumnData {
	/**
	 * Holds level codes.
	 */
	public final int[] data;
	/**
	 * Ordered levels that codes refer to.
	 */
	public final FactorLevels levels;
	/**
	 * Initializes code array for given cardinality.
	 *
	 * @param cardinality	number of rows
	 * @param levels		ordered levels of the column
	 */
	public FactorData(int cardinality, FactorLevels levels) {
		super(cardinality);
		this.data = new int[cardinality];
		this.levels = levels;
	}
	/**
	 * Creates a column from level names. Java null
	 * references become NULL values.
	 *
	 * @param levels	ordered levels of the column
	 * @param values	level name for each row
	 * @return			new factor column
	 */
	public static FactorData of(FactorLevels levels, String... values) {
		FactorData column = new FactorData(values.length, levels);
		for (int row=0; row<values.length; ++row) {
			if (values[row] == null) {
				column.isNull.set(row);
				continue;
			}
			int code = levels.getCode(values[row]);
			if (code < 0) {
				throw new IllegalArgumentException("Error - value " +
						values[row] + " is not a level of " + levels);
			}
			column.data[row] = code;
		}
		return column;
	}
	/**
	 * Creates a column containing each level exactly
	 * once, in level order.
	 *
	 * @param levels	ordered levels
	 * @return			column with one row per level
	 */
	public static FactorData allLevels(FactorLevels levels) {
		FactorData column = new FactorData(levels.nrLevels, levels);
		for (int code=0; code<levels.nrLevels; ++code) {
			column.data[code] = code;
		}
		return column;
	}

	@Override
	protected int compareValues(int row1, int row2) {
		return Integer.compare(data[row1], data[row2]);
	}

	@Override
	public Object valueAt(int row) {
		return isNull.get(row) ? null : levels.getLevel(data[row]);
	}

	@Override
	public ColumnData copyRows(int[] rowsToCopy) {
		FactorData copyColumn = new FactorData(rowsToCopy.length, levels);
		int copiedRowCtr = 0;
		for (int row : rowsToCopy) {
			// Treat special case: insertion of null values
			if (row==-1) {
				copyColumn.data[copiedRowCtr] = 0;
				copyColumn.isNull.set(copiedRowCtr);
			} else {
				copyColumn.data[copiedRowCtr] = data[row];
				copyColumn.isNull.set(copiedRowCtr, isNull.get(row));
			}
			++copiedRowCtr;
		}
		return copyColumn;
	}
}
