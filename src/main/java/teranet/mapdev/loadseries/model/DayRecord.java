package teranet.mapdev.loadseries.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Objects;

/**
 * One calendar day of one metric: the slot values in time order, NaN marking a missing
 * reading. The values array is shared with callers so strategies can fill it in place.
 */
public final class DayRecord {

    private final LocalDate date;
    private final double[] values;

    public DayRecord(LocalDate date, double[] values) {
        this.date = Objects.requireNonNull(date, "date");
        this.values = Objects.requireNonNull(values, "values");
    }

    public LocalDate getDate() {
        return date;
    }

    public double[] getValues() {
        return values;
    }

    public int size() {
        return values.length;
    }

    public DayRecord copy() {
        return new DayRecord(date, values.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DayRecord)) {
            return false;
        }
        DayRecord other = (DayRecord) o;
        return date.equals(other.date) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * date.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DayRecord{" + date + ", " + values.length + " slots}";
    }
}
