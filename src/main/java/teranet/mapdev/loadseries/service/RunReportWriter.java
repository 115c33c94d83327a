package teranet.mapdev.loadseries.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the run summary as run-summary.json next to the anonymized files.
 */
@Service
public class RunReportWriter {

    public static final String REPORT_FILE_NAME = "run-summary.json";

    private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

    private final ObjectMapper objectMapper;

    public RunReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * A report that cannot be written is logged; it never changes the run outcome.
     *
     * @return the report path, or null if writing failed
     */
    public Path write(PipelineRunResultDto result, Path outputRoot) {
        Path reportPath = outputRoot.resolve(REPORT_FILE_NAME);
        try {
            Files.createDirectories(outputRoot);
            objectMapper.writeValue(reportPath.toFile(), result);
            logger.info("Wrote run summary: {}", reportPath);
            return reportPath;
        } catch (IOException e) {
            logger.error("Failed to write run summary to {}", reportPath, e);
            return null;
        }
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
