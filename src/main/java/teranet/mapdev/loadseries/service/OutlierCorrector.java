package teranet.mapdev.loadseries.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.imputation.Gaps;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.util.Arrays;

/**
 * Replaces extreme readings with values interpolated from their column neighbours.
 *
 * Each slot column is checked on its own across all days: anything outside
 * [Q1 - k*IQR, Q3 + k*IQR] is cleared and the column re-filled linearly, holding the
 * nearest value at both ends. Quartiles use linear interpolation between order
 * statistics (R-7).
 */
@Service
@Slf4j
public class OutlierCorrector {

    private final CleaningConfig cleaningConfig;

    public OutlierCorrector(CleaningConfig cleaningConfig) {
        this.cleaningConfig = cleaningConfig;
    }

    public int correct(MetricSeries series) {
        return correct(series, cleaningConfig.getOutlier().getIqrMultiplier());
    }

    /**
     * Correct the series in place.
     *
     * @param series     series whose day arrays are updated
     * @param multiplier k, non-negative
     * @return number of cells replaced
     */
    public int correct(MetricSeries series, double multiplier) {
        if (Double.isNaN(multiplier) || multiplier < 0.0) {
            throw new IllegalArgumentException("IQR multiplier must be non-negative, got " + multiplier);
        }
        double[][] matrix = series.valueMatrix();
        if (matrix.length == 0) {
            return 0;
        }

        int corrected = 0;
        for (int col = 0; col < series.slotCount(); col++) {
            corrected += correctColumn(matrix, col, multiplier);
        }
        if (corrected > 0) {
            log.debug("{}: corrected {} outlier cells", series.getLabel(), corrected);
        }
        return corrected;
    }

    private int correctColumn(double[][] matrix, int col, double multiplier) {
        double[] column = Gaps.column(matrix, col);
        double[] known = Arrays.stream(column).filter(v -> !Double.isNaN(v)).toArray();
        if (known.length == 0) {
            return 0;
        }

        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(known);
        double q1 = percentile.evaluate(25.0);
        double q3 = percentile.evaluate(75.0);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;

        int outliers = 0;
        for (int row = 0; row < column.length; row++) {
            double value = column[row];
            if (!Double.isNaN(value) && (value < lower || value > upper)) {
                column[row] = Double.NaN;
                outliers++;
            }
        }
        if (outliers == 0) {
            return 0;
        }

        Gaps.linearFillExtended(column);
        for (int row = 0; row < column.length; row++) {
            if (!Double.isNaN(column[row])) {
                matrix[row][col] = SeriesValues.round(column[row]);
            }
        }
        return outliers;
    }
}
