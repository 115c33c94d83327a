package teranet.mapdev.loadseries.imputation;

/**
 * Vector helpers shared by the strategies. All of them only write NaN cells.
 */
public final class Gaps {

    private Gaps() {
    }

    public static double[] column(double[][] matrix, int col) {
        double[] values = new double[matrix.length];
        for (int row = 0; row < matrix.length; row++) {
            values[row] = matrix[row][col];
        }
        return values;
    }

    /**
     * Write back the cells of a column that were missing in the matrix.
     *
     * @return number of cells filled
     */
    public static int mergeColumn(double[][] matrix, int col, double[] values) {
        int filled = 0;
        for (int row = 0; row < matrix.length; row++) {
            if (Double.isNaN(matrix[row][col]) && !Double.isNaN(values[row])) {
                matrix[row][col] = values[row];
                filled++;
            }
        }
        return filled;
    }

    public static int firstKnown(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                return i;
            }
        }
        return -1;
    }

    public static int lastKnown(double[] values) {
        for (int i = values.length - 1; i >= 0; i--) {
            if (!Double.isNaN(values[i])) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Propagate the last known value forward, then the next known value backward.
     *
     * @return number of cells filled
     */
    public static int forwardThenBackwardFill(double[] values) {
        int filled = 0;
        double last = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                if (!Double.isNaN(last)) {
                    values[i] = last;
                    filled++;
                }
            } else {
                last = values[i];
            }
        }
        double next = Double.NaN;
        for (int i = values.length - 1; i >= 0; i--) {
            if (Double.isNaN(values[i])) {
                if (!Double.isNaN(next)) {
                    values[i] = next;
                    filled++;
                }
            } else {
                next = values[i];
            }
        }
        return filled;
    }

    /**
     * Piecewise linear fill over the index axis. Gaps before the first and after the last
     * known value take that nearest value. Nothing happens when no value is known.
     *
     * @return number of cells filled
     */
    public static int linearFillExtended(double[] values) {
        int first = firstKnown(values);
        if (first < 0) {
            return 0;
        }
        int filled = 0;
        for (int i = 0; i < first; i++) {
            values[i] = values[first];
            filled++;
        }
        int left = first;
        for (int i = first + 1; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            if (i - left > 1) {
                double step = (values[i] - values[left]) / (i - left);
                for (int gap = left + 1; gap < i; gap++) {
                    values[gap] = values[left] + step * (gap - left);
                    filled++;
                }
            }
            left = i;
        }
        for (int i = left + 1; i < values.length; i++) {
            values[i] = values[left];
            filled++;
        }
        return filled;
    }
}
