package teranet.mapdev.loadseries.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of the cohort validity check for one transformer.
 */
public final class CohortDecision {

    private final boolean retained;
    private final SortedSet<LocalDate> commonDates;
    private final String reason;

    private CohortDecision(boolean retained, SortedSet<LocalDate> commonDates, String reason) {
        this.retained = retained;
        this.commonDates = Collections.unmodifiableSortedSet(new TreeSet<>(commonDates));
        this.reason = reason;
    }

    public static CohortDecision retained(SortedSet<LocalDate> commonDates) {
        return new CohortDecision(true, commonDates, null);
    }

    public static CohortDecision dropped(SortedSet<LocalDate> commonDates, String reason) {
        return new CohortDecision(false, commonDates, reason);
    }

    public boolean isRetained() {
        return retained;
    }

    public SortedSet<LocalDate> getCommonDates() {
        return commonDates;
    }

    /**
     * Why the transformer was dropped; null when retained.
     */
    public String getReason() {
        return reason;
    }
}
