package teranet.mapdev.loadseries.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.AggregateSummaryStatistics;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.model.DayRecord;
import teranet.mapdev.loadseries.model.GlobalDispersionStats;
import teranet.mapdev.loadseries.model.MetricCategory;
import teranet.mapdev.loadseries.model.MetricSeries;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * First anonymization pass: pools every reading per category across the whole corpus
 * and derives one population standard deviation per category.
 *
 * Files are summarized independently (possibly on worker threads) and the partial
 * summaries merged afterwards, so no shared accumulator is touched concurrently.
 * Files of unknown category do not contribute.
 */
@Service
@Slf4j
public class NoiseCalibrator {

    private final MetricCategoryClassifier classifier;

    public NoiseCalibrator(MetricCategoryClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Summarize one file. Missing cells are ignored.
     */
    public PartialSummary summarize(MetricSeries series) {
        MetricCategory category = classifier.classify(series.getLabel());
        SummaryStatistics statistics = new SummaryStatistics();
        for (DayRecord day : series.getDays()) {
            for (double value : day.getValues()) {
                if (!Double.isNaN(value)) {
                    statistics.addValue(value);
                }
            }
        }
        return new PartialSummary(series.getLabel(), category, statistics);
    }

    /**
     * Merge per-file summaries into the immutable corpus statistics.
     */
    public GlobalDispersionStats calibrate(Collection<PartialSummary> partials) {
        Map<MetricCategory, List<SummaryStatistics>> byCategory = new EnumMap<>(MetricCategory.class);
        for (PartialSummary partial : partials) {
            if (partial.getCategory() == MetricCategory.UNKNOWN) {
                continue;
            }
            byCategory.computeIfAbsent(partial.getCategory(), c -> new ArrayList<>()).add(partial.getStatistics());
        }

        GlobalDispersionStats stats = new GlobalDispersionStats(
                populationStd(byCategory.get(MetricCategory.CURRENT)),
                populationStd(byCategory.get(MetricCategory.VOLTAGE)),
                populationStd(byCategory.get(MetricCategory.POWER)));
        log.info("Calibrated dispersion over {} files: {}", partials.size(), stats);
        return stats;
    }

    static double populationStd(List<SummaryStatistics> parts) {
        if (parts == null || parts.isEmpty()) {
            return GlobalDispersionStats.DEFAULT_STD;
        }
        StatisticalSummary pooled = AggregateSummaryStatistics.aggregate(parts);
        long n = pooled.getN();
        if (n == 0) {
            return GlobalDispersionStats.DEFAULT_STD;
        }
        if (n == 1) {
            return 0.0;
        }
        // aggregate() reports the bias-corrected variance
        double populationVariance = pooled.getVariance() * (n - 1) / n;
        return Math.sqrt(Math.max(populationVariance, 0.0));
    }

    /**
     * Pooled values of a single file, tagged with its category.
     */
    public static class PartialSummary {
        private final String label;
        private final MetricCategory category;
        private final SummaryStatistics statistics;

        PartialSummary(String label, MetricCategory category, SummaryStatistics statistics) {
            this.label = label;
            this.category = category;
            this.statistics = statistics;
        }

        public String getLabel() {
            return label;
        }

        public MetricCategory getCategory() {
            return category;
        }

        public SummaryStatistics getStatistics() {
            return statistics;
        }

        public long getCount() {
            return statistics.getN();
        }
    }
}
