package teranet.mapdev.loadseries.service;

import org.junit.jupiter.api.Test;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.MetricCategory;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MetricCategoryClassifier
 */
class MetricCategoryClassifierTest {

    private final MetricCategoryClassifier classifier = new MetricCategoryClassifier(new CleaningConfig());

    @Test
    void testClassify_DefaultTokens() {
        assertThat(classifier.classify("AXDL.csv")).isEqualTo(MetricCategory.CURRENT);
        assertThat(classifier.classify("BXDY.csv")).isEqualTo(MetricCategory.VOLTAGE);
        assertThat(classifier.classify("AXYGGL.csv")).isEqualTo(MetricCategory.POWER);
        assertThat(classifier.classify("WGGL.csv")).isEqualTo(MetricCategory.POWER);
        assertThat(classifier.classify("temperature.csv")).isEqualTo(MetricCategory.UNKNOWN);
    }

    @Test
    void testClassify_CaseInsensitive() {
        assertThat(classifier.classify("axdl.csv")).isEqualTo(MetricCategory.CURRENT);
    }

    @Test
    void testClassify_FirstMatchingCategoryWins() {
        // Given: a label carrying both a current and a power token
        assertThat(classifier.classify("XDL_GGL.csv")).isEqualTo(MetricCategory.CURRENT);
    }

    @Test
    void testClassify_ConfiguredTokens() {
        CleaningConfig config = new CleaningConfig();
        config.getCategories().setVoltageTokens(List.of("volt"));
        MetricCategoryClassifier custom = new MetricCategoryClassifier(config);

        assertThat(custom.classify("phase_a_VOLTAGE.csv")).isEqualTo(MetricCategory.VOLTAGE);
        assertThat(custom.classify(null)).isEqualTo(MetricCategory.UNKNOWN);
    }

    @Test
    void testClassify_ConfiguredOrderDecidesOverlaps() {
        // Given: power tried before current
        CleaningConfig config = new CleaningConfig();
        config.getCategories().setOrder(List.of(MetricCategory.POWER, MetricCategory.CURRENT, MetricCategory.VOLTAGE));
        MetricCategoryClassifier custom = new MetricCategoryClassifier(config);

        assertThat(custom.classify("XDL_GGL.csv")).isEqualTo(MetricCategory.POWER);
        assertThat(custom.classify("AXDL.csv")).isEqualTo(MetricCategory.CURRENT);
    }

    @Test
    void testClassify_CategoryLeftOutOfOrderNeverMatches() {
        CleaningConfig config = new CleaningConfig();
        config.getCategories().setOrder(List.of(MetricCategory.CURRENT, MetricCategory.VOLTAGE));
        MetricCategoryClassifier custom = new MetricCategoryClassifier(config);

        assertThat(custom.classify("AXYGGL.csv")).isEqualTo(MetricCategory.UNKNOWN);
    }
}
