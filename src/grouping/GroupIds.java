package grouping;

import java.util.List;

/**
 * Composite group ID for each row, together with the
 * number of groups and the per-key codes they combine.
 *
 * @author immanueltrummer
 *
 */
public class GroupIds {
	/**
	 * Group ID of each row.
	 */
	public final int[] ids;
	/**
	 * Number of groups (IDs range from zero to this number).
	 */
	public final int nrGroups;
	/**
	 * Codes of each key column, in key order.
	 */
	public final List<KeyCodes> keyCodes;
	/**
	 * Policy under which IDs were assigned.
	 */
	public final DropPolicy policy;
	/**
	 * Initializes group IDs.
	 *
	 * @param ids		group ID for each row
	 * @param nrGroups	number of groups
	 * @param keyCodes	codes of key columns
	 * @param policy	policy used for ID assignment
	 */
	public GroupIds(int[] ids, int nrGroups,
			List<KeyCodes> keyCodes, DropPolicy policy) {
		this.ids = ids;
		this.nrGroups = nrGroups;
		this.keyCodes = keyCodes;
		this.policy = policy;
	}
}
