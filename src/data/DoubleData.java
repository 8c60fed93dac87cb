package data;

/**
 * Represents content of numeric column.
 *
 * @author immanueltrummer
 *
 */
public class DoubleData extends ColumnData {
	/**
	 * Holds double data.
	 */
	public final double[] data;
	/**
	 * Initializes data array for given cardinality.
	 *
	 * @param cardinality	number of rows
	 */
	public DoubleData(int cardinality) {
		super(cardinality);
		this.data = new double[cardinality];
	}
	/**
	 * Creates a column holding the given values (no NULLs).
	 *
	 * @param values	column content
	 * @return			new numeric column
	 */
	public static DoubleData of(double... values) {
		DoubleData column = new DoubleData(values.length);
		System.arraycopy(values, 0, column.data, 0, values.length);
		return column;
	}

	@Override
	protected int compareValues(int row1, int row2) {
		return Double.compare(data[row1], data[row2]);
	}

	@Override
	public Object valueAt(int row) {
		return isNull.get(row) ? null : data[row];
	}

	@Override
	public ColumnData copyRows(int[] rowsToCopy) {
		DoubleData copyColumn = new DoubleData(rowsToCopy.length);
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
