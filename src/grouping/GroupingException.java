package grouping;

/**
 * An exception caused by grouping keys that do not
 * match the grouped dataset.
 *
 * @author immanueltrummer
 *
 */
public class GroupingException extends Exception {
	/**
	 * Initialize exception with error description.
	 *
	 * @param text	text to show to users
	 */
	public GroupingException(String text) {
		super(text);
	}
}
