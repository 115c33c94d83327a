package teranet.mapdev.loadseries.service;

import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.GlobalDispersionStats;
import teranet.mapdev.loadseries.model.MetricCategory;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.util.SeriesValues;

/**
 * Second anonymization pass: perturbs every reading with Gaussian noise scaled by the
 * calibrated dispersion of its category.
 *
 * current: max(v + n, 0)
 * voltage: v + n
 * power:   v * (1 + n), so a zero reading stays zero
 * unknown: v + n, with the voltage dispersion times a small fraction
 */
@Service
public class NoiseInjector {

    private final CleaningConfig cleaningConfig;

    public NoiseInjector(CleaningConfig cleaningConfig) {
        this.cleaningConfig = cleaningConfig;
    }

    /**
     * Standard deviation of the noise drawn for a category.
     */
    public double sigma(MetricCategory category, GlobalDispersionStats stats) {
        CleaningConfig.Noise noise = cleaningConfig.getNoise();
        switch (category) {
            case CURRENT:
                return stats.getCurrentStd() * noise.getCurrentFactor();
            case VOLTAGE:
                return stats.getVoltageStd() * noise.getVoltageFactor();
            case POWER:
                return stats.getPowerStd() * noise.getPowerFactor();
            case UNKNOWN:
            default:
                return stats.getVoltageStd() * noise.getUnknownVoltageFraction();
        }
    }

    /**
     * @return a perturbed copy; missing cells stay missing, values rounded to 4 decimals
     */
    public MetricSeries inject(MetricSeries series, MetricCategory category, GlobalDispersionStats stats,
            RandomGenerator random) {
        double sigma = sigma(category, stats);
        MetricSeries noisy = series.deepCopy();
        for (double[] row : noisy.valueMatrix()) {
            for (int col = 0; col < row.length; col++) {
                double value = row[col];
                if (Double.isNaN(value)) {
                    continue;
                }
                double n = random.nextGaussian() * sigma;
                row[col] = SeriesValues.round(perturb(category, value, n));
            }
        }
        return noisy;
    }

    static double perturb(MetricCategory category, double value, double n) {
        switch (category) {
            case CURRENT:
                return Math.max(value + n, 0.0);
            case POWER:
                return value * (1.0 + n);
            case VOLTAGE:
            case UNKNOWN:
            default:
                return value + n;
        }
    }
}
