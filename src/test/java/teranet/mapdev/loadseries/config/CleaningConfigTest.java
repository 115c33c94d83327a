package teranet.mapdev.loadseries.config;

import org.junit.jupiter.api.Test;
import teranet.mapdev.loadseries.exception.InvalidConfigurationException;
import teranet.mapdev.loadseries.model.MetricCategory;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for configuration validation
 */
class CleaningConfigTest {

    @Test
    void testDefaults_AreValid() {
        assertThatCode(() -> new CleaningConfig().validate()).doesNotThrowAnyException();
        assertThatCode(() -> new PipelineConfig().validate()).doesNotThrowAnyException();
    }

    @Test
    void testThresholdOutOfRange_Rejected() {
        CleaningConfig config = new CleaningConfig();
        config.getCompleteness().setThreshold(1.2);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("cleaning.completeness.threshold");
    }

    @Test
    void testNegativeIqrMultiplier_Rejected() {
        CleaningConfig config = new CleaningConfig();
        config.getOutlier().setIqrMultiplier(-0.5);

        assertThatThrownBy(config::validate).hasMessageContaining("cleaning.outlier.iqr-multiplier");
    }

    @Test
    void testMinValidDaysBelowOne_Rejected() {
        CleaningConfig config = new CleaningConfig();
        config.getCohort().setMinValidDays(0);

        assertThatThrownBy(config::validate).hasMessageContaining("cleaning.cohort.min-valid-days");
    }

    @Test
    void testNegativeNoiseFactor_Rejected() {
        CleaningConfig config = new CleaningConfig();
        config.getNoise().setPowerFactor(-0.02);

        assertThatThrownBy(config::validate).hasMessageContaining("cleaning.noise.power-factor");
    }

    @Test
    void testCategoryOrderWithDuplicatesOrUnknown_Rejected() {
        CleaningConfig duplicated = new CleaningConfig();
        duplicated.getCategories().setOrder(List.of(MetricCategory.CURRENT, MetricCategory.CURRENT));
        CleaningConfig unknown = new CleaningConfig();
        unknown.getCategories().setOrder(List.of(MetricCategory.UNKNOWN, MetricCategory.POWER));

        assertThatThrownBy(duplicated::validate).hasMessageContaining("cleaning.categories.order");
        assertThatThrownBy(unknown::validate).hasMessageContaining("cleaning.categories.order");
    }

    @Test
    void testCategoryTokensInOrder() {
        CleaningConfig config = new CleaningConfig();
        config.getCategories().setOrder(List.of(MetricCategory.VOLTAGE, MetricCategory.POWER));

        assertThat(config.getCategories().tokensInOrder())
                .containsExactly(entry(MetricCategory.VOLTAGE, List.of("XDY")), entry(MetricCategory.POWER, List.of("GGL")));
    }

    @Test
    void testPipeline_MaxConcurrentFilesBelowOne_Rejected() {
        PipelineConfig config = new PipelineConfig();
        config.setMaxConcurrentFiles(0);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("pipeline.max-concurrent-files");
    }
}
