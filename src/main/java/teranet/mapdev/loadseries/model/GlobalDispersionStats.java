package teranet.mapdev.loadseries.model;

/**
 * Corpus-wide standard deviations per measurement category, computed once by the
 * calibration pass and only read afterwards.
 */
public final class GlobalDispersionStats {

    /** Used when a category has no pooled values at all */
    public static final double DEFAULT_STD = 1.0;

    private final double currentStd;
    private final double voltageStd;
    private final double powerStd;

    public GlobalDispersionStats(double currentStd, double voltageStd, double powerStd) {
        this.currentStd = currentStd;
        this.voltageStd = voltageStd;
        this.powerStd = powerStd;
    }

    public double getCurrentStd() {
        return currentStd;
    }

    public double getVoltageStd() {
        return voltageStd;
    }

    public double getPowerStd() {
        return powerStd;
    }

    /**
     * Dispersion of a category; UNKNOWN has none of its own and reports the voltage one.
     */
    public double stdFor(MetricCategory category) {
        switch (category) {
            case CURRENT:
                return currentStd;
            case POWER:
                return powerStd;
            case VOLTAGE:
            case UNKNOWN:
            default:
                return voltageStd;
        }
    }

    @Override
    public String toString() {
        return String.format("GlobalDispersionStats{current=%.6f, voltage=%.6f, power=%.6f}",
                currentStd, voltageStd, powerStd);
    }
}
