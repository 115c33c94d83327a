package teranet.mapdev.loadseries.config;

import lombok.Data;
import teranet.mapdev.loadseries.exception.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the directory-to-directory pipeline.
 * Maps properties from application.properties with prefix "pipeline".
 *
 * Folder layout used by a run:
 * - input-root:  line/transformer/metric.csv produced by the extraction step
 * - work-root:   intermediate stage output (preprocessed, filtered)
 * - output-root: anonymized files plus run-summary.json
 * - publish.root: optional copy with display file names
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    public static final String PREPROCESSED_DIR = "preprocessed";
    public static final String FILTERED_DIR = "filtered";

    // Folder paths (stage output under work-root: preprocessed, filtered)
    private String inputRoot = "data/extracted";
    private String workRoot = "data/work";
    private String outputRoot = "data/anonymized";

    // Processing settings
    private boolean parallel = true;
    private int maxConcurrentFiles = 4;
    private boolean writeByteOrderMark = true;
    private int maxReportedIssues = 200;
    private boolean runOnStartup = false;

    private Publish publish = new Publish();

    /**
     * Final copy step that gives metric files readable names
     */
    @Data
    public static class Publish {
        private boolean enabled = false;
        private String root = "data/published";

        /** Metric code (file name prefix) to display name */
        private Map<String, String> displayNames = new LinkedHashMap<>();
    }

    /**
     * Reject folder and concurrency settings a run cannot start with.
     *
     * @throws InvalidConfigurationException naming the first offending property
     */
    public void validate() {
        requireText("pipeline.input-root", inputRoot);
        requireText("pipeline.work-root", workRoot);
        requireText("pipeline.output-root", outputRoot);
        if (maxConcurrentFiles < 1) {
            throw InvalidConfigurationException.invalidProperty(
                    "pipeline.max-concurrent-files", maxConcurrentFiles, "at least 1");
        }
        if (maxReportedIssues < 0) {
            throw InvalidConfigurationException.invalidProperty(
                    "pipeline.max-reported-issues", maxReportedIssues, "a non-negative number");
        }
        if (publish.isEnabled()) {
            requireText("pipeline.publish.root", publish.getRoot());
        }
    }

    private static void requireText(String property, String value) {
        if (value == null || value.isBlank()) {
            throw InvalidConfigurationException.invalidProperty(property, value, "a folder path");
        }
    }
}
