package teranet.mapdev.loadseries.imputation;

/**
 * Extends the first and last reading of a day over the slots before and after them.
 */
public class TailFlatFillStrategy implements ImputationStrategy {

    @Override
    public String name() {
        return "tail-flat-fill";
    }

    @Override
    public int fill(double[][] matrix) {
        int filled = 0;
        for (double[] row : matrix) {
            filled += Gaps.forwardThenBackwardFill(row);
        }
        return filled;
    }
}
