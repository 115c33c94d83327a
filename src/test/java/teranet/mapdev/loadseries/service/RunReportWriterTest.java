package teranet.mapdev.loadseries.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for RunReportWriter
 */
class RunReportWriterTest {

    @TempDir
    Path tempDir;

    private final RunReportWriter writer = new RunReportWriter();

    @Test
    void testWrite_SnakeCaseJsonWithIsoDates() throws IOException {
        // Given
        PipelineRunResultDto result = new PipelineRunResultDto();
        result.setRunId("run-1");
        result.setProcessingStatus(PipelineRunResultDto.SUCCESS);
        result.setProcessingStartTime(LocalDateTime.of(2023, 5, 1, 8, 30));
        StageResult stage = new StageResult("FILTER");
        stage.setEntitiesDropped(3);
        result.getStageResults().add(stage);

        // When
        Path report = writer.write(result, tempDir.resolve("out"));

        // Then
        assertThat(report).exists().hasFileName(RunReportWriter.REPORT_FILE_NAME);
        JsonNode json = writer.getObjectMapper().readTree(report.toFile());
        assertThat(json.get("run_id").asText()).isEqualTo("run-1");
        assertThat(json.get("processing_start_time").asText()).isEqualTo("2023-05-01T08:30:00");
        assertThat(json.get("stage_results").get(0).get("entities_dropped").asInt()).isEqualTo(3);
    }

    @Test
    void testWrite_UnwritableLocation_ReturnsNull() throws IOException {
        Path file = java.nio.file.Files.createFile(tempDir.resolve("not-a-dir"));

        assertThat(writer.write(new PipelineRunResultDto(), file)).isNull();
    }

    @Test
    void testAddIssue_Bounded() {
        StageResult stage = new StageResult("PREPROCESS");

        stage.addIssue("a", 2);
        stage.addIssue("b", 2);
        stage.addIssue("c", 2);

        assertThat(stage.getIssues()).containsExactly("a", "b");
        assertThat(stage.getIssuesTruncated()).isEqualTo(1);
    }
}
