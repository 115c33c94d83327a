package teranet.mapdev.loadseries.imputation;

/**
 * One step of the gap-filling cascade.
 *
 * The matrix handed to a strategy is rows x slots (one row per day, one column per
 * 15-minute slot), with NaN marking a missing cell. A strategy may only write cells that
 * are NaN when it is called; known values are never touched. Cells it cannot fill stay
 * NaN for the next strategy.
 */
public interface ImputationStrategy {

    /**
     * Short name used in logs and fill reports.
     */
    String name();

    /**
     * Fill what this strategy can, in place.
     *
     * @param matrix rows x slots, all rows the same length
     * @return number of cells that went from missing to known
     */
    int fill(double[][] matrix);
}
