package grouping;

import data.ColumnData;
import data.Dataset;

/**
 * Computes a key vector from the rows of a dataset.
 *
 * @author immanueltrummer
 *
 */
@FunctionalInterface
public interface KeyExpression {
	/**
	 * Evaluates the expression for each row of the dataset.
	 *
	 * @param dataset	dataset to evaluate on
	 * @return			one value per row
	 */
	ColumnData evaluate(Dataset dataset);
}
