package teranet.mapdev.loadseries.model;

/**
 * Measurement category of a metric file. Decides which dispersion constant and which
 * noise model apply to its values.
 */
public enum MetricCategory {
    /** Phase currents; noise is additive and floored at zero */
    CURRENT,
    /** Phase voltages; noise is additive */
    VOLTAGE,
    /** Active and reactive power; noise is multiplicative */
    POWER,
    /** No token matched; a small fraction of the voltage dispersion is used */
    UNKNOWN
}
