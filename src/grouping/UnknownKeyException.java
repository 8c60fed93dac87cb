package grouping;

/**
 * Thrown if a grouping key does not resolve
 * against the dataset.
 *
 * @author immanueltrummer
 *
 */
public class UnknownKeyException extends GroupingException {
	/**
	 * Name of the unresolved key.
	 */
	public final String keyName;
	/**
	 * Initializes exception for given key.
	 *
	 * @param keyName	name of unknown key
	 */
	public UnknownKeyException(String keyName) {
		super("Error - unknown grouping key " + keyName);
		this.keyName = keyName;
	}
}
