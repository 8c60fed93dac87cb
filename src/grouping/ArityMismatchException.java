package grouping;

/**
 * Thrown if the length of a key vector disagrees
 * with the row count of the dataset.
 *
 * @author immanueltrummer
 *
 */
public class ArityMismatchException extends GroupingException {
	/**
	 * Name of the offending key.
	 */
	public final String keyName;
	/**
	 * Expected number of rows.
	 */
	public final int expected;
	/**
	 * Actual length of key vector.
	 */
	public final int actual;
	/**
	 * Initializes exception for given key and lengths.
	 *
	 * @param keyName	name of key
	 * @param expected	row count of dataset
	 * @param actual	length of key vector
	 */
	public ArityMismatchException(String keyName, int expected, int actual) {
		super("Error - key " + keyName + " has " + actual +
				" values but dataset has " + expected + " rows");
		this.keyName = keyName;
		this.expected = expected;
		this.actual = actual;
	}
}
