package teranet.mapdev.loadseries.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * All day records of one metric of one transformer, as read from a single CSV file.
 *
 * The label is the file name (e.g. "AXDL.csv"); the header names are kept so the file
 * can be written back with the same layout.
 */
public final class MetricSeries {

    private final String label;
    private final String dateColumn;
    private final List<String> slotColumns;
    private final List<DayRecord> days;

    public MetricSeries(String label, String dateColumn, List<String> slotColumns, List<DayRecord> days) {
        this.label = Objects.requireNonNull(label, "label");
        this.dateColumn = Objects.requireNonNull(dateColumn, "dateColumn");
        this.slotColumns = List.copyOf(slotColumns);
        this.days = new ArrayList<>(days);
    }

    public String getLabel() {
        return label;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public List<String> getSlotColumns() {
        return slotColumns;
    }

    public List<DayRecord> getDays() {
        return Collections.unmodifiableList(days);
    }

    public int slotCount() {
        return slotColumns.size();
    }

    public int dayCount() {
        return days.size();
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    /**
     * Rows x slots view backed by the day records' own arrays.
     */
    public double[][] valueMatrix() {
        double[][] matrix = new double[days.size()][];
        for (int row = 0; row < days.size(); row++) {
            matrix[row] = days.get(row).getValues();
        }
        return matrix;
    }

    /**
     * Same header, different rows.
     */
    public MetricSeries withDays(List<DayRecord> newDays) {
        return new MetricSeries(label, dateColumn, slotColumns, newDays);
    }

    public MetricSeries deepCopy() {
        return withDays(days.stream().map(DayRecord::copy).collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return "MetricSeries{" + label + ", " + days.size() + " days}";
    }
}
