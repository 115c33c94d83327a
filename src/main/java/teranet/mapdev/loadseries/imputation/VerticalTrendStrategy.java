package teranet.mapdev.loadseries.imputation;

/**
 * Linear interpolation down each slot column (same time of day across consecutive
 * rows), carrying the first and last known value out to the ends of the column.
 */
public class VerticalTrendStrategy implements ImputationStrategy {

    @Override
    public String name() {
        return "vertical-linear";
    }

    @Override
    public int fill(double[][] matrix) {
        if (matrix.length == 0) {
            return 0;
        }
        int filled = 0;
        for (int col = 0; col < matrix[0].length; col++) {
            double[] column = Gaps.column(matrix, col);
            if (Gaps.linearFillExtended(column) > 0) {
                filled += Gaps.mergeColumn(matrix, col, column);
            }
        }
        return filled;
    }
}
