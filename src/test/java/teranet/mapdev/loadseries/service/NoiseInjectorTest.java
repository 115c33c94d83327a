package teranet.mapdev.loadseries.service;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.GlobalDispersionStats;
import teranet.mapdev.loadseries.model.MetricCategory;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static teranet.mapdev.loadseries.util.TestSeriesFactory.*;

/**
 * Unit tests for NoiseInjector
 */
class NoiseInjectorTest {

    private static final double NaN = Double.NaN;

    private CleaningConfig config;
    private NoiseInjector injector;
    private GlobalDispersionStats stats;

    @BeforeEach
    void setUp() {
        config = new CleaningConfig();
        injector = new NoiseInjector(config);
        stats = new GlobalDispersionStats(10.0, 5.0, 100.0);
    }

    @Test
    void testSigma_PerCategory() {
        assertThat(injector.sigma(MetricCategory.CURRENT, stats)).isCloseTo(0.5, within(1e-12));
        assertThat(injector.sigma(MetricCategory.VOLTAGE, stats)).isCloseTo(0.05, within(1e-12));
        assertThat(injector.sigma(MetricCategory.POWER, stats)).isCloseTo(2.0, within(1e-12));
        assertThat(injector.sigma(MetricCategory.UNKNOWN, stats)).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void testInject_CurrentNeverNegative() {
        // Given: small currents and a large sigma
        MetricSeries series = series("AXDL.csv", new double[] {0, 0.1, 0.2, 0.05, 0, 0.3, 0.1, 0});
        GlobalDispersionStats wide = new GlobalDispersionStats(100.0, 1.0, 1.0);

        MetricSeries noisy = injector.inject(series, MetricCategory.CURRENT, wide, new MersenneTwister(1L));

        assertThat(Arrays.stream(noisy.getDays().get(0).getValues()).boxed()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    void testInject_PowerZeroStaysZero() {
        MetricSeries series = series("AXYGGL.csv", new double[] {0, 12.5, 0, -3});

        MetricSeries noisy = injector.inject(series, MetricCategory.POWER, stats, new MersenneTwister(2L));

        double[] values = noisy.getDays().get(0).getValues();
        assertThat(values[0]).isEqualTo(0.0);
        assertThat(values[2]).isEqualTo(0.0);
    }

    @Test
    void testInject_ExactFormulas() {
        // Given: a generator that always draws 1.0
        RandomGenerator random = mock(RandomGenerator.class);
        when(random.nextGaussian()).thenReturn(1.0);

        double voltage = injector.inject(series("AXDY.csv", new double[] {220}), MetricCategory.VOLTAGE, stats, random)
                .getDays().get(0).getValues()[0];
        double power = injector.inject(series("AXYGGL.csv", new double[] {10}), MetricCategory.POWER, stats, random)
                .getDays().get(0).getValues()[0];
        double current = injector.inject(series("AXDL.csv", new double[] {1}), MetricCategory.CURRENT, stats, random)
                .getDays().get(0).getValues()[0];

        assertThat(voltage).isEqualTo(220.05);
        assertThat(power).isEqualTo(30.0);
        assertThat(current).isEqualTo(1.5);
    }

    @Test
    void testInject_MissingCellsStayMissingAndInputUntouched() {
        MetricSeries series = series("AXDY.csv", new double[] {220, NaN});

        MetricSeries noisy = injector.inject(series, MetricCategory.VOLTAGE, stats, new MersenneTwister(3L));

        assertThat(noisy.getDays().get(0).getValues()[1]).isNaN();
        assertThat(series.getDays().get(0).getValues()[0]).isEqualTo(220.0);
    }

    @Test
    void testInject_ResultRoundedAndReproducibleWithSameSeed() {
        MetricSeries series = series("AXDY.csv", new double[] {220.1, 219.9, 221.3});

        MetricSeries first = injector.inject(series, MetricCategory.VOLTAGE, stats, new MersenneTwister(42L));
        MetricSeries second = injector.inject(series, MetricCategory.VOLTAGE, stats, new MersenneTwister(42L));

        assertThat(first.getDays()).isEqualTo(second.getDays());
        for (double v : first.getDays().get(0).getValues()) {
            assertThat(SeriesValues.round(v)).isEqualTo(v);
        }
    }

    @Test
    void testPerturb_CurrentClampedAtZero() {
        assertThat(NoiseInjector.perturb(MetricCategory.CURRENT, 1.0, -5.0)).isEqualTo(0.0);
        assertThat(NoiseInjector.perturb(MetricCategory.UNKNOWN, 1.0, -5.0)).isEqualTo(-4.0);
    }
}
