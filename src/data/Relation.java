package data;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * In-memory relation consisting of named columns
 * of equal cardinality.
 *
 * @author immanueltrummer
 *
 */
public class Relation implements Dataset {
	/**
	 * Name of the relation.
	 */
	public final String name;
	/**
	 * Ordered list of column names.
	 */
	final List<String> columnNames;
	/**
	 * Maps column names to column data.
	 */
	final Map<String, ColumnData> nameToCol;
	/**
	 * Number of rows in each column.
	 */
	int cardinality;
	/**
	 * Initializes empty relation with given name and cardinality.
	 *
	 * @param name			relation name
	 * @param cardinality	number of rows
	 */
	public Relation(String name, int cardinality) {
		this.name = name;
		this.cardinality = cardinality;
		this.columnNames = new ArrayList<String>();
		this.nameToCol = new HashMap<String, ColumnData>();
	}
	/**
	 * Adds given column to this relation.
	 *
	 * @param columnName	name of new column
	 * @param column		data of new column
	 * @return				this relation
	 */
	public Relation addColumn(String columnName, ColumnData column) {
		// Check whether column of same name exists
		if (nameToCol.containsKey(columnName)) {
			throw new IllegalArgumentException("Error - column " +
					columnName + " exists in relation " + name);
		}
		if (column.cardinality != cardinality) {
			throw new IllegalArgumentException("Error - column " +
					columnName + " has " + column.cardinality +
					" rows but relation " + name + " has " + cardinality);
		}
		// Insert new column
		columnNames.add(columnName);
		nameToCol.put(columnName, column);
		return this;
	}
	/**
	 * Removes column with given name if it exists.
	 *
	 * @param columnName	name of column to remove
	 */
	public void dropColumn(String columnName) {
		if (nameToCol.remove(columnName) != null) {
			columnNames.remove(columnName);
		}
	}
	/**
	 * Keeps only the rows whose indices are set in the given
	 * bit set, replacing the data of all columns.
	 *
	 * @param rowsToKeep	indices of rows to keep
	 */
	public void retainRows(BitSet rowsToKeep) {
		for (String columnName : columnNames) {
			ColumnData column = nameToCol.get(columnName);
			nameToCol.put(columnName, column.copyRows(rowsToKeep));
		}
		cardinality = rowsToKeep.cardinality();
	}
	/**
	 * Creates a new relation containing the given rows
	 * of all columns, in the given order.
	 *
	 * @param source		dataset to copy from
	 * @param newName		name of new relation
	 * @param rowsToCopy	indices of rows to copy
	 * @return				new relation
	 */
	public static Relation copyRows(Dataset source,
			String newName, int[] rowsToCopy) {
		Relation copy = new Relation(newName, rowsToCopy.length);
		for (String columnName : source.getColumnNames()) {
			ColumnData column = source.getColumn(columnName);
			copy.addColumn(columnName, column.copyRows(rowsToCopy));
		}
		return copy;
	}

	@Override
	public int getCardinality() {
		return cardinality;
	}

	@Override
	public ColumnData getColumn(String columnName) {
		return nameToCol.get(columnName);
	}

	@Override
	public List<String> getColumnNames() {
		return Collections.unmodifiableList(columnNames);
	}

	@Override
	public String toString() {
		return name + "(" + StringUtils.join(columnNames, ", ") +
				") [" + cardinality + " rows]";
	}
}
