package teranet.mapdev.loadseries.imputation;

/**
 * Forward then backward propagation down each slot column.
 */
public class BoundaryFillStrategy implements ImputationStrategy {

    @Override
    public String name() {
        return "boundary-fill";
    }

    @Override
    public int fill(double[][] matrix) {
        if (matrix.length == 0) {
            return 0;
        }
        int filled = 0;
        for (int col = 0; col < matrix[0].length; col++) {
            double[] column = Gaps.column(matrix, col);
            if (Gaps.forwardThenBackwardFill(column) > 0) {
                filled += Gaps.mergeColumn(matrix, col, column);
            }
        }
        return filled;
    }
}
