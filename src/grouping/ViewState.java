package grouping;

/**
 * Lifecycle state of a grouped view.
 *
 * @author immanueltrummer
 *
 */
public enum ViewState {
	/**
	 * Keys and policy are set, labels and index are not built.
	 */
	LAZY,
	/**
	 * Labels and index are built.
	 */
	MATERIALIZED,
	/**
	 * Grouping was removed, no further transitions.
	 */
	UNGROUPED
}
