package data;

import java.util.List;

/**
 * Read access to a columnar dataset whose rows can be grouped.
 *
 * @author immanueltrummer
 *
 */
public interface Dataset {
	/**
	 * Returns the number of rows.
	 *
	 * @return	row count
	 */
	int getCardinality();
	/**
	 * Returns data of the column with given name.
	 *
	 * @param columnName	name of column
	 * @return				column data or null if no such column exists
	 */
	ColumnData getColumn(String columnName);
	/**
	 * Returns names of all columns in their defined order.
	 *
	 * @return	ordered list of column names
	 */
	List<String> getColumnNames();
}
