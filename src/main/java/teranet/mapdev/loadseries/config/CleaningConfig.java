package teranet.mapdev.loadseries.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import teranet.mapdev.loadseries.exception.InvalidConfigurationException;
import teranet.mapdev.loadseries.imputation.ImputationProfile;
import teranet.mapdev.loadseries.model.MetricCategory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tuning knobs for the cleaning and anonymization stages.
 *
 * Maps directly to properties in application.properties:
 * - cleaning.completeness.threshold
 * - cleaning.imputation.profile / slot-count
 * - cleaning.outlier.enabled / iqr-multiplier
 * - cleaning.cohort.min-valid-days
 * - cleaning.noise.* (factors, unknown-voltage-fraction, seed)
 * - cleaning.categories.* (file name tokens per measurement category, matching order)
 */
@Configuration
@ConfigurationProperties(prefix = "cleaning")
@Data
public class CleaningConfig {

    // ========================================
    // ROW COMPLETENESS (cleaning.completeness.*)
    // ========================================

    private Completeness completeness = new Completeness();

    @Data
    public static class Completeness {
        /**
         * Maximum fraction of missing or zero slots a row may have and still be kept.
         * Range [0, 1].
         */
        private double threshold = 0.3;
    }

    // ========================================
    // GAP IMPUTATION (cleaning.imputation.*)
    // ========================================

    private Imputation imputation = new Imputation();

    @Data
    public static class Imputation {
        /** Strategy cascade to apply */
        private ImputationProfile profile = ImputationProfile.DAY_SLOT_MATRIX;

        /** Number of value columns per day (one every 15 minutes) */
        private int slotCount = 96;
    }

    // ========================================
    // OUTLIER CORRECTION (cleaning.outlier.*)
    // ========================================

    private Outlier outlier = new Outlier();

    @Data
    public static class Outlier {
        private boolean enabled = true;

        /** k in [Q1 - k*IQR, Q3 + k*IQR] */
        private double iqrMultiplier = 1.5;
    }

    // ========================================
    // COHORT VALIDITY (cleaning.cohort.*)
    // ========================================

    private Cohort cohort = new Cohort();

    @Data
    public static class Cohort {
        /** Minimum number of dates on which every metric file of a transformer is usable */
        private int minValidDays = 30;
    }

    // ========================================
    // NOISE (cleaning.noise.*)
    // ========================================

    private Noise noise = new Noise();

    @Data
    public static class Noise {
        private boolean enabled = true;

        private double currentFactor = 0.05;
        private double voltageFactor = 0.01;
        private double powerFactor = 0.02;

        /** Fraction of the voltage dispersion used for files of unknown category */
        private double unknownVoltageFraction = 0.01;

        /** Optional seed for reproducible runs; random when unset */
        private Long seed;
    }

    // ========================================
    // CATEGORY TOKENS (cleaning.categories.*)
    // ========================================

    private Categories categories = new Categories();

    @Data
    public static class Categories {
        private List<String> currentTokens = new ArrayList<>(List.of("XDL"));
        private List<String> voltageTokens = new ArrayList<>(List.of("XDY"));
        private List<String> powerTokens = new ArrayList<>(List.of("GGL"));

        /** Categories in the order they are tried; the first whose token matches wins */
        private List<MetricCategory> order = new ArrayList<>(
                List.of(MetricCategory.CURRENT, MetricCategory.VOLTAGE, MetricCategory.POWER));

        public Map<MetricCategory, List<String>> tokensInOrder() {
            Map<MetricCategory, List<String>> tokens = new LinkedHashMap<>();
            for (MetricCategory category : order) {
                tokens.put(category, tokensFor(category));
            }
            return tokens;
        }

        private List<String> tokensFor(MetricCategory category) {
            switch (category) {
                case CURRENT:
                    return currentTokens;
                case VOLTAGE:
                    return voltageTokens;
                case POWER:
                    return powerTokens;
                default:
                    throw new IllegalArgumentException("No tokens for category " + category);
            }
        }
    }

    /**
     * Reject settings the stages cannot work with.
     *
     * @throws InvalidConfigurationException naming the first offending property
     */
    public void validate() {
        double threshold = completeness.getThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.completeness.threshold", threshold, "a value in [0, 1]");
        }
        if (imputation.getSlotCount() < 1) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.imputation.slot-count", imputation.getSlotCount(), "a positive number");
        }
        if (imputation.getProfile() == null) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.imputation.profile", null, "DAY_SLOT_MATRIX or FLAT_TABLE");
        }
        if (Double.isNaN(outlier.getIqrMultiplier()) || outlier.getIqrMultiplier() < 0.0) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.outlier.iqr-multiplier", outlier.getIqrMultiplier(), "a non-negative number");
        }
        if (cohort.getMinValidDays() < 1) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.cohort.min-valid-days", cohort.getMinValidDays(), "at least 1");
        }
        requireCategoryOrder(categories.getOrder());
        requireNonNegative("cleaning.noise.current-factor", noise.getCurrentFactor());
        requireNonNegative("cleaning.noise.voltage-factor", noise.getVoltageFactor());
        requireNonNegative("cleaning.noise.power-factor", noise.getPowerFactor());
        requireNonNegative("cleaning.noise.unknown-voltage-fraction", noise.getUnknownVoltageFraction());
    }

    private static void requireCategoryOrder(List<MetricCategory> order) {
        boolean valid = order != null;
        Set<MetricCategory> seen = new HashSet<>();
        if (valid) {
            for (MetricCategory category : order) {
                if (category == null || category == MetricCategory.UNKNOWN || !seen.add(category)) {
                    valid = false;
                    break;
                }
            }
        }
        if (!valid) {
            throw InvalidConfigurationException.invalidProperty(
                    "cleaning.categories.order", order, "distinct categories among CURRENT, VOLTAGE, POWER");
        }
    }

    private static void requireNonNegative(String property, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw InvalidConfigurationException.invalidProperty(property, value, "a non-negative number");
        }
    }
}
