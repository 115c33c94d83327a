package teranet.mapdev.loadseries.imputation;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Last resort: every remaining gap takes the median of its slot column, or 0 when the
 * column has no reading at all.
 */
@Slf4j
public class ColumnMedianStrategy implements ImputationStrategy {

    @Override
    public String name() {
        return "column-median";
    }

    @Override
    public int fill(double[][] matrix) {
        if (matrix.length == 0) {
            return 0;
        }
        int filled = 0;
        for (int col = 0; col < matrix[0].length; col++) {
            double[] column = Gaps.column(matrix, col);
            double[] known = Arrays.stream(column).filter(v -> !Double.isNaN(v)).toArray();
            if (known.length == column.length) {
                continue;
            }
            double median = known.length == 0 ? 0.0 : median(known);
            log.debug("Slot {} imputed with median {}", col, median);
            for (int row = 0; row < matrix.length; row++) {
                if (Double.isNaN(matrix[row][col])) {
                    matrix[row][col] = median;
                    filled++;
                }
            }
        }
        return filled;
    }

    static double median(double[] values) {
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, 50.0);
    }
}
