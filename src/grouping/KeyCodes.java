package grouping;

import data.ColumnData;

/**
 * Dense codes of one key column: codes follow key
 * order and range from zero to the number of codes.
 *
 * @author immanueltrummer
 *
 */
public class KeyCodes {
	/**
	 * Code of the key value in each row.
	 */
	public final int[] codes;
	/**
	 * Number of distinct codes.
	 */
	public final int nrCodes;
	/**
	 * Holds for each code the associated key value.
	 */
	public final ColumnData values;
	/**
	 * Initializes codes of one key.
	 *
	 * @param codes		code for each row
	 * @param nrCodes	number of distinct codes
	 * @param values	key value for each code
	 */
	public KeyCodes(int[] codes, int nrCodes, ColumnData values) {
		this.codes = codes;
		this.nrCodes = nrCodes;
		this.values = values;
	}
}
