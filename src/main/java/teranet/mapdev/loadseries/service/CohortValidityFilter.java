package teranet.mapdev.loadseries.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.model.CohortDecision;
import teranet.mapdev.loadseries.model.DayRecord;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.model.TransformerCohort;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Keeps a transformer only when all of its metric files share enough usable days.
 *
 * A day is usable in a file when at least one slot holds a non-zero reading. The common
 * dates are the intersection over every file of the transformer.
 */
@Service
@Slf4j
public class CohortValidityFilter {

    private final CleaningConfig cleaningConfig;

    public CohortValidityFilter(CleaningConfig cleaningConfig) {
        this.cleaningConfig = cleaningConfig;
    }

    /**
     * Dates of a series whose missing-or-zero count is strictly below the slot count.
     */
    public SortedSet<LocalDate> validDates(MetricSeries series) {
        SortedSet<LocalDate> valid = new TreeSet<>();
        for (DayRecord day : series.getDays()) {
            int missing = 0;
            for (double value : day.getValues()) {
                if (SeriesValues.isMissingOrZero(value)) {
                    missing++;
                }
            }
            if (missing < day.size()) {
                valid.add(day.getDate());
            }
        }
        return valid;
    }

    public CohortDecision evaluate(TransformerCohort cohort) {
        return evaluate(cohort, cleaningConfig.getCohort().getMinValidDays());
    }

    /**
     * @param cohort       all metric files of one transformer
     * @param minValidDays minimum size of the common date set
     */
    public CohortDecision evaluate(TransformerCohort cohort, int minValidDays) {
        if (cohort.isEmpty()) {
            return CohortDecision.dropped(new TreeSet<>(), "no metric files");
        }

        SortedSet<LocalDate> common = null;
        for (MetricSeries series : cohort.getSeries().values()) {
            SortedSet<LocalDate> valid = validDates(series);
            if (common == null) {
                common = valid;
            } else {
                common.retainAll(valid);
            }
        }

        if (common.isEmpty()) {
            return CohortDecision.dropped(common, "no date is valid in every metric file");
        }
        if (common.size() < minValidDays) {
            return CohortDecision.dropped(common, String.format(
                    "only %d common valid days, at least %d required", common.size(), minValidDays));
        }
        return CohortDecision.retained(common);
    }

    /**
     * Restrict every series of a retained cohort to the common dates, sorted by date.
     * When a date occurs twice in a file the first row wins.
     */
    public TransformerCohort apply(TransformerCohort cohort, CohortDecision decision) {
        if (!decision.isRetained()) {
            throw new IllegalArgumentException("Cannot apply a dropped cohort decision for " + cohort);
        }
        Map<String, MetricSeries> restricted = new LinkedHashMap<>();
        for (Map.Entry<String, MetricSeries> entry : cohort.getSeries().entrySet()) {
            restricted.put(entry.getKey(), restrict(entry.getValue(), decision.getCommonDates()));
        }
        return new TransformerCohort(cohort.getLineCode(), cohort.getTransformerCode(), restricted);
    }

    private MetricSeries restrict(MetricSeries series, Set<LocalDate> dates) {
        List<DayRecord> kept = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        for (DayRecord day : series.getDays()) {
            if (dates.contains(day.getDate()) && seen.add(day.getDate())) {
                kept.add(day);
            }
        }
        if (kept.size() < series.dayCount()) {
            log.debug("{}: kept {} of {} rows on common dates", series.getLabel(), kept.size(), series.dayCount());
        }
        kept.sort(Comparator.comparing(DayRecord::getDate));
        return series.withDays(kept);
    }
}
