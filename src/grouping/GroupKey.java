package grouping;

import data.ColumnData;
import data.Dataset;

/**
 * Refers to one grouping key: either a named column of the
 * grouped dataset or a vector derived from its rows.
 *
 * @author immanueltrummer
 *
 */
public class GroupKey {
	/**
	 * Name of the key (column name for column keys).
	 */
	public final String name;
	/**
	 * Computes derived key vectors, null for column keys.
	 */
	final KeyExpression expression;

	GroupKey(String name, KeyExpression expression) {
		this.name = name;
		this.expression = expression;
	}
	/**
	 * Creates a key referring to the column of given name.
	 *
	 * @param columnName	name of key column
	 * @return				new grouping key
	 */
	public static GroupKey column(String columnName) {
		return new GroupKey(columnName, null);
	}
	/**
	 * Creates a key whose values are derived from the
	 * rows of the grouped dataset.
	 *
	 * @param name			name of key in group labels
	 * @param expression	computes key values
	 * @return				new grouping key
	 */
	public static GroupKey derived(String name, KeyExpression expression) {
		return new GroupKey(name, expression);
	}
	/**
	 * Whether this key refers to a column of the dataset.
	 *
	 * @return	true iff this is a column key
	 */
	public boolean isColumn() {
		return expression == null;
	}
	/**
	 * Checks whether the key can be resolved against the dataset
	 * without evaluating derived keys.
	 *
	 * @param dataset	grouped dataset
	 * @throws UnknownKeyException	if the key column does not exist
	 */
	void validate(Dataset dataset) throws UnknownKeyException {
		if (isColumn() && dataset.getColumn(name) == null) {
			throw new UnknownKeyException(name);
		}
	}
	/**
	 * Returns the key vector for the current rows of the dataset.
	 *
	 * @param dataset	grouped dataset
	 * @return			one key value per row
	 * @throws GroupingException	if the key does not resolve or
	 * 								its length differs from row count
	 */
	public ColumnData resolve(Dataset dataset) throws GroupingException {
		ColumnData keyData = isColumn() ?
				dataset.getColumn(name) : expression.evaluate(dataset);
		if (keyData == null) {
			throw new UnknownKeyException(name);
		}
		int cardinality = dataset.getCardinality();
		if (keyData.cardinality != cardinality) {
			throw new ArityMismatchException(
					name, cardinality, keyData.cardinality);
		}
		return keyData;
	}
	@Override
	public boolean equals(Object other) {
		if (other instanceof GroupKey) {
			GroupKey otherKey = (GroupKey)other;
			return name.equals(otherKey.name) &&
					expression == otherKey.expression;
		} else {
			return false;
		}
	}
	@Override
	public int hashCode() {
		return name.hashCode();
	}
	@Override
	public String toString() {
		return name;
	}
}
