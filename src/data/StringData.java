package data;

/**
 * Represents content of string column.
 *
 * @author immanueltrummer
 *
 */
public class StringData extends ColumnData {
	/**
	 * Holds actual string data.
	 */
	public final String[] data;
	/**
	 * Initializes data array for given cardinality.
	 *
	 * @param cardinality	number of rows
	 */
	public StringData(int cardinality) {
		super(cardinality);
		this.data = new String[cardinality];
	}
	/**
	 * Creates a column holding the given values, Java
	 * null references become NULL values.
	 *
	 * @param values	column content
	 * @return			new string column
	 */
	public static StringData of(String... values) {
		StringData column = new StringData(values.length);
		for (int row=0; row<values.length; ++row) {
			column.data[row] = values[row];
			column.isNull.set(row, values[row] == null);
		}
		return column;
	}

	@Override
	protected int compareValues(int row1, int row2) {
		return data[row1].compareTo(data[row2]);
	}

	@Override
	public Object valueAt(int row) {
		return isNull.get(row) ? null : data[row];
	}

	@Override
	public ColumnData copyRows(int[] rowsToCopy) {
		StringData copyColumn = new StringData(rowsToCopy.length);
		int copiedRowCtr = 0;
		for (int row : rowsToCopy) {
			// Treat special case: inserted null values
			if (row==-1) {
				copyColumn.data[copiedRowCtr] = null;
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
