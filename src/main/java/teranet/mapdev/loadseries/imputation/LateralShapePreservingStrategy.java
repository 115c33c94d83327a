package teranet.mapdev.loadseries.imputation;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

/**
 * Fills gaps inside a day using PCHIP over the slot index.
 *
 * Only the interior of a row is filled: slots before the first or after the last known
 * reading of that day are left for {@link TailFlatFillStrategy}. When PCHIP cannot be
 * built (too few readings) or yields a non-finite value, the same interior is filled
 * with a piecewise linear interpolation instead.
 */
@Slf4j
public class LateralShapePreservingStrategy implements ImputationStrategy {

    private final UnivariateInterpolator shapePreserving;
    private final UnivariateInterpolator linear;

    public LateralShapePreservingStrategy() {
        this(new PchipInterpolator(), new LinearInterpolator());
    }

    LateralShapePreservingStrategy(UnivariateInterpolator shapePreserving, UnivariateInterpolator linear) {
        this.shapePreserving = shapePreserving;
        this.linear = linear;
    }

    @Override
    public String name() {
        return "lateral-pchip";
    }

    @Override
    public int fill(double[][] matrix) {
        int filled = 0;
        for (int row = 0; row < matrix.length; row++) {
            filled += fillRow(matrix[row], row);
        }
        return filled;
    }

    private int fillRow(double[] values, int row) {
        int first = Gaps.firstKnown(values);
        int last = Gaps.lastKnown(values);
        if (first < 0 || last - first < 2) {
            return 0;
        }

        int known = 0;
        boolean interiorGap = false;
        for (int i = first; i <= last; i++) {
            if (Double.isNaN(values[i])) {
                interiorGap = true;
            } else {
                known++;
            }
        }
        if (!interiorGap) {
            return 0;
        }

        double[] x = new double[known];
        double[] y = new double[known];
        int k = 0;
        for (int i = first; i <= last; i++) {
            if (!Double.isNaN(values[i])) {
                x[k] = i;
                y[k] = values[i];
                k++;
            }
        }

        double[] interpolated = evaluate(shapePreserving, x, y, first, last);
        if (interpolated == null) {
            log.debug("Row {}: shape-preserving interpolation failed with {} readings, using linear", row, known);
            interpolated = evaluate(linear, x, y, first, last);
        }
        if (interpolated == null) {
            return 0;
        }

        int filled = 0;
        for (int i = first; i <= last; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = interpolated[i - first];
                filled++;
            }
        }
        return filled;
    }

    /**
     * @return values for slots first..last, or null if the interpolator failed
     */
    private static double[] evaluate(UnivariateInterpolator interpolator, double[] x, double[] y, int first, int last) {
        try {
            UnivariateFunction function = interpolator.interpolate(x, y);
            double[] result = new double[last - first + 1];
            for (int i = first; i <= last; i++) {
                double value = function.value(i);
                if (!Double.isFinite(value)) {
                    return null;
                }
                result[i - first] = value;
            }
            return result;
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            return null;
        }
    }
}
