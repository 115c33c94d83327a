package teranet.mapdev.loadseries.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.loadseries.exception.PipelineStageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StageSupportTest {

    @TempDir
    Path tempDir;

    @Test
    void testPrepareOutputDirectory_CreatesFolderWithMarker() {
        Path output = tempDir.resolve("work/filtered");

        StageSupport.prepareOutputDirectory(tempDir.resolve("in"), output);

        assertThat(output).isDirectory();
        assertThat(output.resolve(StageSupport.OUTPUT_MARKER)).isRegularFile();
    }

    @Test
    void testPrepareOutputDirectory_EmptyExistingFolderIsAdopted() throws IOException {
        Path output = Files.createDirectories(tempDir.resolve("out"));

        StageSupport.prepareOutputDirectory(tempDir.resolve("in"), output);

        assertThat(output.resolve(StageSupport.OUTPUT_MARKER)).isRegularFile();
    }

    @Test
    void testPrepareOutputDirectory_RefusesForeignFolder() throws IOException {
        // Given: a folder the pipeline never wrote to
        Path documents = Files.createDirectories(tempDir.resolve("documents"));
        Path thesis = Files.write(documents.resolve("thesis.docx"), "chapter 1".getBytes(StandardCharsets.UTF_8));
        Path nested = Files.createDirectories(documents.resolve("photos")).resolve("a.csv");
        Files.write(nested, "x".getBytes(StandardCharsets.UTF_8));

        // When / Then
        assertThatThrownBy(() -> StageSupport.prepareOutputDirectory(tempDir.resolve("in"), documents))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("not created by this pipeline");
        assertThat(thesis).hasContent("chapter 1");
        assertThat(nested).exists();
        assertThat(documents.resolve(StageSupport.OUTPUT_MARKER)).doesNotExist();
    }

    @Test
    void testPrepareOutputDirectory_ClearsFolderFromEarlierRun() throws IOException {
        Path output = tempDir.resolve("out");
        StageSupport.prepareOutputDirectory(tempDir.resolve("in"), output);
        Path old = Files.createDirectories(output.resolve("1/A")).resolve("AXDL.csv");
        Files.write(old, "Date,Value_1\n".getBytes(StandardCharsets.UTF_8));

        StageSupport.prepareOutputDirectory(tempDir.resolve("in"), output);

        assertThat(old).doesNotExist();
        assertThat(output.resolve("1")).doesNotExist();
        assertThat(output.resolve(StageSupport.OUTPUT_MARKER)).isRegularFile();
    }

    @Test
    void testPrepareOutputDirectory_RunSummaryMarksOwnership() throws IOException {
        Path output = Files.createDirectories(tempDir.resolve("anonymized"));
        Files.write(output.resolve(RunReportWriter.REPORT_FILE_NAME), "{}".getBytes(StandardCharsets.UTF_8));

        StageSupport.prepareOutputDirectory(tempDir.resolve("in"), output);

        assertThat(output.resolve(RunReportWriter.REPORT_FILE_NAME)).doesNotExist();
    }

    @Test
    void testPrepareOutputDirectory_OverlapRejected() {
        Path input = tempDir.resolve("data");

        assertThatThrownBy(() -> StageSupport.prepareOutputDirectory(input, input.resolve("out")))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("overlaps");
        assertThatThrownBy(() -> StageSupport.prepareOutputDirectory(input, tempDir))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("overlaps");
    }

    @Test
    void testPrepareOutputDirectory_FileInsteadOfFolderRejected() throws IOException {
        Path file = Files.write(tempDir.resolve("out"), "x".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> StageSupport.prepareOutputDirectory(tempDir.resolve("in"), file))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("not a directory");
        assertThat(file).hasContent("x");
    }
}
