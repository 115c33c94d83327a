package teranet.mapdev.loadseries.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The metric files of one transformer, keyed by file name in read order. They are
 * kept or dropped together.
 */
public final class TransformerCohort {

    private final String lineCode;
    private final String transformerCode;
    private final Map<String, MetricSeries> series;

    public TransformerCohort(String lineCode, String transformerCode, Map<String, MetricSeries> series) {
        this.lineCode = Objects.requireNonNull(lineCode, "lineCode");
        this.transformerCode = Objects.requireNonNull(transformerCode, "transformerCode");
        this.series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
    }

    public String getLineCode() {
        return lineCode;
    }

    public String getTransformerCode() {
        return transformerCode;
    }

    public Map<String, MetricSeries> getSeries() {
        return series;
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    @Override
    public String toString() {
        return "TransformerCohort{" + lineCode + "/" + transformerCode + ", " + series.size() + " files}";
    }
}
