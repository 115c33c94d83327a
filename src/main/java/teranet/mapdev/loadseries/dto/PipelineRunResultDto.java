package teranet.mapdev.loadseries.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a pipeline run, returned by the API and written as run-summary.json.
 */
@Data
@NoArgsConstructor
public class PipelineRunResultDto {

    public static final String SUCCESS = "SUCCESS";
    public static final String PARTIAL_SUCCESS = "PARTIAL_SUCCESS";
    public static final String FAILED = "FAILED";

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("processing_status")
    private String processingStatus; // SUCCESS, PARTIAL_SUCCESS, FAILED

    @JsonProperty("processing_start_time")
    private LocalDateTime processingStartTime;

    @JsonProperty("processing_end_time")
    private LocalDateTime processingEndTime;

    @JsonProperty("processing_duration_ms")
    private Long processingDurationMs;

    @JsonProperty("calibration")
    private Calibration calibration;

    @JsonProperty("stage_results")
    private List<StageResult> stageResults = new ArrayList<>();

    @JsonProperty("error_message")
    private String errorMessage;

    /**
     * Counters of one stage. Fields that do not apply to a stage stay zero.
     */
    @Data
    @NoArgsConstructor
    public static class StageResult {
        @JsonProperty("stage")
        private String stage;

        @JsonProperty("status")
        private String status; // SUCCESS, PARTIAL_SUCCESS, FAILED

        @JsonProperty("input_dir")
        private String inputDir;

        @JsonProperty("output_dir")
        private String outputDir;

        @JsonProperty("files_succeeded")
        private int filesSucceeded;

        @JsonProperty("files_failed")
        private int filesFailed;

        @JsonProperty("rows_dropped")
        private long rowsDropped;

        @JsonProperty("malformed_rows_skipped")
        private long malformedRowsSkipped;

        @JsonProperty("cells_imputed")
        private long cellsImputed;

        @JsonProperty("outliers_corrected")
        private long outliersCorrected;

        @JsonProperty("lines_retained")
        private int linesRetained;

        @JsonProperty("lines_dropped")
        private int linesDropped;

        @JsonProperty("entities_retained")
        private int entitiesRetained;

        @JsonProperty("entities_dropped")
        private int entitiesDropped;

        @JsonProperty("processing_duration_ms")
        private Long processingDurationMs;

        @JsonProperty("issues")
        private List<String> issues = new ArrayList<>();

        @JsonProperty("issues_truncated")
        private int issuesTruncated;

        public StageResult(String stage) {
            this.stage = stage;
        }

        /**
         * Record an issue message, keeping at most {@code limit} of them.
         */
        public void addIssue(String issue, int limit) {
            if (issues.size() < limit) {
                issues.add(issue);
            } else {
                issuesTruncated++;
            }
        }
    }

    /**
     * Dispersion constants of the anonymization pass and the noise sigma they produce.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Calibration {
        @JsonProperty("current_std")
        private double currentStd;

        @JsonProperty("voltage_std")
        private double voltageStd;

        @JsonProperty("power_std")
        private double powerStd;

        @JsonProperty("current_noise_sigma")
        private double currentNoiseSigma;

        @JsonProperty("voltage_noise_sigma")
        private double voltageNoiseSigma;

        @JsonProperty("power_noise_sigma")
        private double powerNoiseSigma;

        @JsonProperty("unknown_noise_sigma")
        private double unknownNoiseSigma;
    }
}
