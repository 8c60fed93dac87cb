package grouping;

/**
 * Determines which key-tuples become groups.
 *
 * @author immanueltrummer
 *
 */
public enum DropPolicy {
	/**
	 * One group per key-tuple occurring in the data.
	 */
	OBSERVED_ONLY,
	/**
	 * One group per combination of factor levels, including
	 * combinations without rows. Other keys contribute
	 * their observed values.
	 */
	FULL_CROSS_PRODUCT;
	/**
	 * Translates flag indicating whether to drop groups
	 * without rows into a policy.
	 *
	 * @param drop	whether to drop empty groups
	 * @return		associated policy
	 */
	public static DropPolicy fromDrop(boolean drop) {
		return drop ? OBSERVED_ONLY : FULL_CROSS_PRODUCT;
	}
}
