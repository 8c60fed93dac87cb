package grouping;

/**
 * Thrown if a materialized group index no longer
 * matches the row count of the grouped dataset.
 *
 * @author immanueltrummer
 *
 */
public class StaleIndexException extends GroupingException {
	/**
	 * Row count at the time the index was built.
	 */
	public final int indexedRows;
	/**
	 * Current row count of the dataset.
	 */
	public final int currentRows;
	/**
	 * Initializes exception for given row counts.
	 *
	 * @param indexedRows	rows covered by index
	 * @param currentRows	rows in current dataset
	 */
	public StaleIndexException(int indexedRows, int currentRows) {
		super("Error - group index covers " + indexedRows +
				" rows but dataset now has " + currentRows +
				" rows, rebuild the index");
		this.indexedRows = indexedRows;
		this.currentRows = currentRows;
	}
}
