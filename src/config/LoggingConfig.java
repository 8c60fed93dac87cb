package config;

/**
 * Configures debugging output for different stages
 * of grouping.
 *
 * @author immanueltrummer
 *
 */
public class LoggingConfig {
	/**
	 * Whether to generate verbose output while assigning
	 * group IDs and building group indexes.
	 */
	public static boolean GROUPING_VERBOSE = false;
	/**
	 * Whether to log state transitions of grouped views.
	 */
	public static boolean VIEW_VERBOSE = false;
}
