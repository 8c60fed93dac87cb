package grouping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.eclipse.collections.impl.parallel.ParallelIterate;

import com.google.common.math.LongMath;
import com.koloboke.collect.map.hash.HashLongIntMap;
import com.koloboke.collect.map.hash.HashLongIntMaps;

import config.GroupingConfig;
import config.LoggingConfig;
import data.ColumnData;

/**
 * Calculates for each row of a set of key columns (which
 * must have the same cardinality) a consecutive group ID.
 * Group IDs are ranks of key-tuples, ordered by the first
 * key, then by the second key, and so on.
 *
 * @author immanueltrummer
 *
 */
public class IdAssigner {
	/**
	 * Assigns group IDs to rows.
	 *
	 * @param keyNames		name of each key (for error messages)
	 * @param keyCols		data of key columns
	 * @param cardinality	number of rows of grouped dataset
	 * @param policy		whether groups without rows are kept
	 * @return				group ID per row and number of groups
	 * @throws GroupingException	if key lengths mismatch or the
	 * 								number of groups is too large
	 */
	public static GroupIds assign(List<String> keyNames,
			List<ColumnData> keyCols, int cardinality,
			DropPolicy policy) throws GroupingException {
		// Verify that all keys cover each row once
		for (int keyCtr=0; keyCtr<keyCols.size(); ++keyCtr) {
			ColumnData keyCol = keyCols.get(keyCtr);
			if (keyCol.cardinality != cardinality) {
				throw new ArityMismatchException(keyNames.get(keyCtr),
						cardinality, keyCol.cardinality);
			}
		}
		List<KeyCodes> keyCodes = encodeKeys(keyCols, policy);
		long nrCombinations = nrCombinations(keyCodes);
		log("Encoded " + keyCols.size() + " keys for " + cardinality +
				" rows, " + nrCombinations + " key combinations");
		GroupIds result;
		if (policy == DropPolicy.FULL_CROSS_PRODUCT) {
			if (nrCombinations < 0 || nrCombinations > GroupingConfig.MAX_GROUPS) {
				throw new GroupingException("Error - cross product of " +
						"levels of keys " + keyNames + " is too large");
			}
			long[] composite = composite(keyCodes, cardinality);
			int[] ids = new int[cardinality];
			for (int row=0; row<cardinality; ++row) {
				ids[row] = (int)composite[row];
			}
			result = new GroupIds(ids, (int)nrCombinations, keyCodes, policy);
		} else if (nrCombinations >= 0) {
			long[] composite = composite(keyCodes, cardinality);
			result = rankComposite(composite, keyCodes, policy);
		} else {
			result = rankBySorting(keyCodes, cardinality, policy);
		}
		log("Assigned " + result.nrGroups + " group IDs");
		return result;
	}
	/**
	 * Encodes each key column, in parallel if configured.
	 *
	 * @param keyCols	data of key columns
	 * @param policy	whether groups without rows are kept
	 * @return			codes for each key column
	 */
	static List<KeyCodes> encodeKeys(List<ColumnData> keyCols,
			DropPolicy policy) {
		int nrKeys = keyCols.size();
		KeyCodes[] keyCodes = new KeyCodes[nrKeys];
		if (GroupingConfig.PARALLEL_KEY_ENCODING && nrKeys > 1) {
			ParallelIterate.forEachWithIndex(keyCols, (keyCol, keyCtr) -> {
				keyCodes[keyCtr] = KeyEncoder.encode(keyCol, policy);
			});
		} else {
			for (int keyCtr=0; keyCtr<nrKeys; ++keyCtr) {
				keyCodes[keyCtr] = KeyEncoder.encode(keyCols.get(keyCtr), policy);
			}
		}
		return new ArrayList<>(Arrays.asList(keyCodes));
	}
	/**
	 * Returns the product of the number of codes over all keys
	 * or -1 if that product exceeds the range of long values.
	 *
	 * @param keyCodes	codes for each key column
	 * @return			number of possible key combinations or -1
	 */
	static long nrCombinations(List<KeyCodes> keyCodes) {
		long product = 1;
		try {
			for (KeyCodes codes : keyCodes) {
				product = LongMath.checkedMultiply(product, codes.nrCodes);
			}
		} catch (ArithmeticException e) {
			return -1;
		}
		return product;
	}
	/**
	 * Combines codes of all keys into one number per row,
	 * with the first key most significant.
	 *
	 * @param keyCodes		codes for each key column
	 * @param cardinality	number of rows
	 * @return				composite code per row
	 */
	static long[] composite(List<KeyCodes> keyCodes, int cardinality) {
		long[] composite = new long[cardinality];
		for (KeyCodes codes : keyCodes) {
			for (int row=0; row<cardinality; ++row) {
				composite[row] = composite[row] * codes.nrCodes + codes.codes[row];
			}
		}
		return composite;
	}
	/**
	 * Replaces composite codes by their rank among all
	 * composite codes that occur.
	 *
	 * @param composite	composite code per row
	 * @param keyCodes	codes for each key column
	 * @param policy	policy used for ID assignment
	 * @return			dense group IDs
	 */
	static GroupIds rankComposite(long[] composite,
			List<KeyCodes> keyCodes, DropPolicy policy) {
		long[] distinct = composite.clone();
		Arrays.sort(distinct);
		int nrDistinct = 0;
		for (int i=0; i<distinct.length; ++i) {
			if (i == 0 || distinct[i] != distinct[i-1]) {
				distinct[nrDistinct] = distinct[i];
				++nrDistinct;
			}
		}
		HashLongIntMap compositeToID = HashLongIntMaps.newMutableMap(nrDistinct);
		for (int groupID=0; groupID<nrDistinct; ++groupID) {
			compositeToID.put(distinct[groupID], groupID);
		}
		int[] ids = new int[composite.length];
		for (int row=0; row<composite.length; ++row) {
			ids[row] = compositeToID.get(composite[row]);
		}
		return new GroupIds(ids, nrDistinct, keyCodes, policy);
	}
	/**
	 * Assigns group IDs by sorting rows on their key codes,
	 * used if composite codes do not fit into a long value.
	 *
	 * @param keyCodes		codes for each key column
	 * @param cardinality	number of rows
	 * @param policy		policy used for ID assignment
	 * @return				dense group IDs
	 */
	static GroupIds rankBySorting(List<KeyCodes> keyCodes,
			int cardinality, DropPolicy policy) {
		Integer[] rows = new Integer[cardinality];
		for (int row=0; row<cardinality; ++row) {
			rows[row] = row;
		}
		Arrays.sort(rows, (row1, row2) -> compareTuples(keyCodes, row1, row2));
		int[] sortedRows = ArrayUtils.toPrimitive(rows);
		int[] ids = new int[cardinality];
		int nrGroups = 0;
		for (int pos=0; pos<cardinality; ++pos) {
			if (pos > 0 && compareTuples(keyCodes,
					sortedRows[pos-1], sortedRows[pos]) != 0) {
				++nrGroups;
			}
			ids[sortedRows[pos]] = nrGroups;
		}
		if (cardinality > 0) {
			++nrGroups;
		}
		return new GroupIds(ids, nrGroups, keyCodes, policy);
	}
	/**
	 * Compares key-tuples of two rows lexicographically.
	 *
	 * @param keyCodes	codes for each key column
	 * @param row1		index of first row
	 * @param row2		index of second row
	 * @return			comparison result
	 */
	static int compareTuples(List<KeyCodes> keyCodes, int row1, int row2) {
		for (KeyCodes codes : keyCodes) {
			int cmp = Integer.compare(codes.codes[row1], codes.codes[row2]);
			if (cmp != 0) {
				return cmp;
			}
		}
		return 0;
	}
	/**
	 * Output given log text if activated.
	 *
	 * @param logText	text to log if activated
	 */
	static void log(String logText) {
		if (LoggingConfig.GROUPING_VERBOSE) {
			System.out.println(logText);
		}
	}
}
