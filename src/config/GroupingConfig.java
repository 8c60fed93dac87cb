package config;

/**
 * Configuration parameters for building grouping indexes.
 *
 * @author immanueltrummer
 *
 */
public class GroupingConfig {
	/**
	 * Maximal number of groups that a full cross product
	 * of key levels may produce.
	 */
	public final static int MAX_GROUPS = Integer.MAX_VALUE - 8;
	/**
	 * Whether to encode key columns in parallel (produces
	 * the same codes as sequential encoding).
	 */
	public static boolean PARALLEL_KEY_ENCODING = false;
	/**
	 * Whether grouped views are built lazily unless
	 * the caller specifies otherwise.
	 */
	public final static boolean DEFAULT_LAZY = true;
	/**
	 * Whether groups without rows are dropped unless
	 * the caller specifies otherwise.
	 */
	public final static boolean DEFAULT_DROP = true;
}
