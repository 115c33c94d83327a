package teranet.mapdev.loadseries.model;

import java.util.List;

/**
 * A parsed metric file together with the reasons for every row that had to be skipped.
 */
public final class SeriesReadResult {

    private final MetricSeries series;
    private final List<String> skippedRows;

    public SeriesReadResult(MetricSeries series, List<String> skippedRows) {
        this.series = series;
        this.skippedRows = List.copyOf(skippedRows);
    }

    public MetricSeries getSeries() {
        return series;
    }

    public List<String> getSkippedRows() {
        return skippedRows;
    }

    public boolean hasSkippedRows() {
        return !skippedRows.isEmpty();
    }
}
