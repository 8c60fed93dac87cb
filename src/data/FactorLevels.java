package data;

import java.util.Arrays;
import java.util.List;

import com.koloboke.collect.map.hash.HashObjIntMap;
import com.koloboke.collect.map.hash.HashObjIntMaps;

/**
 * Maps the levels of a bounded-category column to codes
 * (and back). Codes follow the externally defined level
 * order, independent of which levels occur in the data.
 *
 * @author immanueltrummer
 *
 */
public class FactorLevels {
	/**
	 * Stores level names in order of code values.
	 */
	final String[] levels;
	/**
	 * Maps level names to their codes.
	 */
	final HashObjIntMap<String> levelToCode;
	/**
	 * Number of levels.
	 */
	public final int nrLevels;
	/**
	 * Initializes levels, given in their defined order.
	 *
	 * @param levels	ordered level names (without duplicates)
	 */
	public FactorLevels(List<String> levels) {
		this.nrLevels = levels.size();
		this.levels = levels.toArray(new String[0]);
		this.levelToCode = HashObjIntMaps.newMutableMap(nrLevels);
		for (int code=0; code<nrLevels; ++code) {
			String level = this.levels[code];
			if (level == null || levelToCode.containsKey(level)) {
				throw new IllegalArgumentException(
						"Error - invalid or duplicate level " + level);
			}
			levelToCode.put(level, code);
		}
	}
	/**
	 * Initializes levels, given in their defined order.
	 *
	 * @param levels	ordered level names
	 */
	public FactorLevels(String... levels) {
		this(Arrays.asList(levels));
	}
	/**
	 * Returns code value for given level or
	 * -1 if the level is unknown.
	 *
	 * @param level	level to search
	 * @return		level code or -1
	 */
	public int getCode(String level) {
		return levelToCode.getOrDefault(level, -1);
	}
	/**
	 * Return level for given code value.
	 *
	 * @param code	searching level for this code
	 * @return		level associated with code value
	 */
	public String getLevel(int code) {
		return levels[code];
	}
	@Override
	public String toString() {
		return Arrays.toString(levels);
	}
}
