package teranet.mapdev.loadseries.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.DayRecord;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops days that have too few readings to be worth repairing.
 *
 * A slot counts as missing when it is NaN or zero. Rows whose missing fraction is above
 * cleaning.completeness.threshold are removed; rows exactly at the threshold are kept.
 */
@Service
@Slf4j
public class RowCompletenessFilter {

    private final CleaningConfig cleaningConfig;

    public RowCompletenessFilter(CleaningConfig cleaningConfig) {
        this.cleaningConfig = cleaningConfig;
    }

    /**
     * Filter with the configured threshold.
     */
    public Result filter(MetricSeries series) {
        return filter(series, cleaningConfig.getCompleteness().getThreshold());
    }

    /**
     * @param series    the series to filter (not modified)
     * @param threshold maximum missing fraction in [0, 1]
     * @return the kept rows as a new series, plus the dates that were dropped
     */
    public Result filter(MetricSeries series, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Completeness threshold must be in [0, 1], got " + threshold);
        }

        List<DayRecord> kept = new ArrayList<>();
        List<LocalDate> dropped = new ArrayList<>();
        for (DayRecord day : series.getDays()) {
            if (missingFraction(day.getValues()) <= threshold) {
                kept.add(day);
            } else {
                dropped.add(day.getDate());
            }
        }

        if (!dropped.isEmpty()) {
            log.info("{}: dropped {} of {} rows with missing ratio above {}",
                    series.getLabel(), dropped.size(), series.dayCount(), threshold);
            log.debug("{}: dropped dates {}", series.getLabel(), dropped);
        }
        if (kept.isEmpty() && !series.isEmpty()) {
            log.warn("{}: every row exceeded the missing ratio threshold", series.getLabel());
        }
        return new Result(series.withDays(kept), dropped);
    }

    /**
     * Fraction of slots that are NaN or zero; 1.0 for a row without slots.
     */
    public static double missingFraction(double[] values) {
        if (values.length == 0) {
            return 1.0;
        }
        int missing = 0;
        for (double value : values) {
            if (SeriesValues.isMissingOrZero(value)) {
                missing++;
            }
        }
        return (double) missing / values.length;
    }

    /**
     * Filtered series and the dates removed from it.
     */
    public static class Result {
        private final MetricSeries series;
        private final List<LocalDate> droppedDates;

        Result(MetricSeries series, List<LocalDate> droppedDates) {
            this.series = series;
            this.droppedDates = List.copyOf(droppedDates);
        }

        public MetricSeries getSeries() {
            return series;
        }

        public List<LocalDate> getDroppedDates() {
            return droppedDates;
        }

        public int getDroppedCount() {
            return droppedDates.size();
        }

        /**
         * True when no row survived; the caller skips imputation for this series.
         */
        public boolean isEmpty() {
            return series.isEmpty();
        }
    }
}
