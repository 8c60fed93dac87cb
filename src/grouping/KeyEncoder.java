package grouping;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import com.koloboke.collect.map.hash.HashDoubleIntMap;
import com.koloboke.collect.map.hash.HashDoubleIntMaps;
import com.koloboke.collect.map.hash.HashIntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.map.hash.HashObjIntMap;
import com.koloboke.collect.map.hash.HashObjIntMaps;

import data.ColumnData;
import data.DoubleData;
import data.FactorData;
import data.IntData;
import data.StringData;

/**
 * Translates the values of one key column into dense codes
 * that follow key order. Factor columns are coded by level
 * order, other columns by the natural order of their
 * distinct values. NULL values receive the last code.
 *
 * @author immanueltrummer
 *
 */
public class KeyEncoder {
	/**
	 * Calculates codes for the given key column.
	 *
	 * @param keyData	values of key column
	 * @param policy	whether to keep factor levels without rows
	 * @return			dense codes of key values
	 */
	public static KeyCodes encode(ColumnData keyData, DropPolicy policy) {
		if (keyData instanceof FactorData) {
			KeyCodes allLevels = encodeFactor((FactorData)keyData);
			return policy == DropPolicy.FULL_CROSS_PRODUCT ?
					allLevels : compact(allLevels);
		}
		int[] canonicalRows = canonicalRows(keyData);
		return encodeCanonical(keyData, canonicalRows);
	}
	/**
	 * Codes factor values by their level, including levels that
	 * do not appear. If the column contains NULL values, those
	 * form one additional code after all levels.
	 *
	 * @param keyData	factor column
	 * @return			codes with one code per level
	 */
	static KeyCodes encodeFactor(FactorData keyData) {
		int nrLevels = keyData.levels.nrLevels;
		boolean hasNulls = !keyData.isNull.isEmpty();
		int nrCodes = hasNulls ? nrLevels + 1 : nrLevels;
		int[] codes = new int[keyData.cardinality];
		for (int row=0; row<keyData.cardinality; ++row) {
			codes[row] = keyData.isNull.get(row) ? nrLevels : keyData.data[row];
		}
		// Each level (and NULL) is represented once
		int[] levelRows = new int[nrCodes];
		for (int code=0; code<nrCodes; ++code) {
			levelRows[code] = code < nrLevels ? code : -1;
		}
		ColumnData values = FactorData.allLevels(keyData.levels).copyRows(levelRows);
		return new KeyCodes(codes, nrCodes, values);
	}
	/**
	 * Removes codes that are not assigned to any row,
	 * preserving the order of remaining codes.
	 *
	 * @param keyCodes	codes to compact
	 * @return			codes without gaps
	 */
	static KeyCodes compact(KeyCodes keyCodes) {
		int[] newCode = new int[keyCodes.nrCodes];
		Arrays.fill(newCode, -1);
		for (int code : keyCodes.codes) {
			newCode[code] = 0;
		}
		MutableIntList usedCodes = IntLists.mutable.empty();
		for (int code=0; code<keyCodes.nrCodes; ++code) {
			if (newCode[code] == 0) {
				newCode[code] = usedCodes.size();
				usedCodes.add(code);
			}
		}
		int[] codes = new int[keyCodes.codes.length];
		for (int row=0; row<codes.length; ++row) {
			codes[row] = newCode[keyCodes.codes[row]];
		}
		ColumnData values = keyCodes.values.copyRows(usedCodes.toArray());
		return new KeyCodes(codes, usedCodes.size(), values);
	}
	/**
	 * Returns for each row the index of the first row holding
	 * an equal value (all NULL rows share the first NULL row).
	 *
	 * @param keyData	values of key column
	 * @return			canonical row for each row
	 */
	static int[] canonicalRows(ColumnData keyData) {
		int cardinality = keyData.cardinality;
		int[] canonical = new int[cardinality];
		int firstNull = keyData.isNull.nextSetBit(0);
		if (keyData instanceof IntData) {
			int[] data = ((IntData)keyData).data;
			HashIntIntMap firstRow = HashIntIntMaps.newMutableMap();
			for (int row=0; row<cardinality; ++row) {
				if (keyData.isNull.get(row)) {
					canonical[row] = firstNull;
					continue;
				}
				int first = firstRow.getOrDefault(data[row], -1);
				if (first < 0) {
					firstRow.put(data[row], row);
					first = row;
				}
				canonical[row] = first;
			}
		} else if (keyData instanceof DoubleData) {
			double[] data = ((DoubleData)keyData).data;
			HashDoubleIntMap firstRow = HashDoubleIntMaps.newMutableMap();
			for (int row=0; row<cardinality; ++row) {
				if (keyData.isNull.get(row)) {
					canonical[row] = firstNull;
					continue;
				}
				int first = firstRow.getOrDefault(data[row], -1);
				if (first < 0) {
					firstRow.put(data[row], row);
					first = row;
				}
				canonical[row] = first;
			}
		} else if (keyData instanceof StringData) {
			String[] data = ((StringData)keyData).data;
			HashObjIntMap<String> firstRow = HashObjIntMaps.newMutableMap();
			for (int row=0; row<cardinality; ++row) {
				if (keyData.isNull.get(row)) {
					canonical[row] = firstNull;
					continue;
				}
				int first = firstRow.getOrDefault(data[row], -1);
				if (first < 0) {
					firstRow.put(data[row], row);
					first = row;
				}
				canonical[row] = first;
			}
		} else {
			throw new IllegalArgumentException("Error - unsupported key type " +
					keyData.getClass().getSimpleName());
		}
		return canonical;
	}
	/**
	 * Ranks the distinct values, each represented by its
	 * canonical row, and codes each row by the rank of its value.
	 *
	 * @param keyData		values of key column
	 * @param canonicalRows	canonical row for each row
	 * @return				dense codes of key values
	 */
	static KeyCodes encodeCanonical(ColumnData keyData, int[] canonicalRows) {
		int cardinality = keyData.cardinality;
		// Collect representatives in order of first occurrence
		MutableIntList representatives = IntLists.mutable.empty();
		for (int row=0; row<cardinality; ++row) {
			if (canonicalRows[row] == row) {
				representatives.add(row);
			}
		}
		Integer[] sorted = ArrayUtils.toObject(representatives.toArray());
		Arrays.sort(sorted, (row1, row2) -> keyData.compareRows(row1, row2));
		int[] rankOfCanonical = new int[cardinality];
		for (int rank=0; rank<sorted.length; ++rank) {
			rankOfCanonical[sorted[rank]] = rank;
		}
		int[] codes = new int[cardinality];
		for (int row=0; row<cardinality; ++row) {
			codes[row] = rankOfCanonical[canonicalRows[row]];
		}
		ColumnData values = keyData.copyRows(ArrayUtils.toPrimitive(sorted));
		return new KeyCodes(codes, sorted.length, values);
	}
}
