package teranet.mapdev.loadseries.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.model.DayRecord;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;
import static teranet.mapdev.loadseries.util.TestSeriesFactory.*;

/**
 * Runs every stage on a small corpus with real components wired by hand.
 */
class PipelineEndToEndTest {

    private static final int SLOTS = 8;

    @TempDir
    Path tempDir;

    private CleaningConfig cleaningConfig;
    private PipelineConfig pipelineConfig;
    private SeriesCsvService csvService;
    private QualityPipelineService pipeline;

    @BeforeEach
    void setUp() {
        cleaningConfig = cleaningConfig(SLOTS);
        cleaningConfig.getCohort().setMinValidDays(3);
        cleaningConfig.getNoise().setSeed(5L);

        pipelineConfig = pipelineConfig();
        pipelineConfig.setInputRoot(tempDir.resolve("extracted").toString());
        pipelineConfig.setWorkRoot(tempDir.resolve("work").toString());
        pipelineConfig.setOutputRoot(tempDir.resolve("anonymized").toString());
        pipelineConfig.getPublish().setEnabled(true);
        pipelineConfig.getPublish().setRoot(tempDir.resolve("published").toString());
        pipelineConfig.getPublish().getDisplayNames().put("AXDL", "Phase A current");

        csvService = new SeriesCsvService(cleaningConfig, pipelineConfig);
        MetricCategoryClassifier classifier = new MetricCategoryClassifier(cleaningConfig);
        pipeline = new QualityPipelineService(
                new PreprocessingService(csvService, new RowCompletenessFilter(cleaningConfig),
                        new GapImputationEngine(cleaningConfig), pipelineConfig, Runnable::run),
                new CohortFilteringService(csvService, new CohortValidityFilter(cleaningConfig),
                        new OutlierCorrector(cleaningConfig), cleaningConfig, pipelineConfig, Runnable::run),
                new AnonymizationService(csvService, classifier, new NoiseCalibrator(classifier),
                        new NoiseInjector(cleaningConfig), cleaningConfig, pipelineConfig, Runnable::run),
                new MetricFileNameService(pipelineConfig),
                new RunReportWriter(),
                cleaningConfig,
                pipelineConfig);
    }

    @Test
    void testRunAll_ProducesCompleteAnonymizedTree() throws IOException {
        // Given: line 5 with a good transformer (gaps included) and one with too few days
        Path extracted = tempDir.resolve("extracted");
        writeCsv(extracted.resolve("5/E7/AXDL.csv"), SLOTS, days(5, "12.5", true));
        writeCsv(extracted.resolve("5/E7/AXDY.csv"), SLOTS, days(5, "221.0", false));
        writeCsv(extracted.resolve("5/E3/AXDL.csv"), SLOTS, days(2, "10.0", false));
        writeCsv(extracted.resolve("5/E3/AXDY.csv"), SLOTS, days(2, "220.0", false));

        // When
        PipelineRunResultDto result = pipeline.runAll(null);

        // Then
        assertThat(result.getProcessingStatus()).isEqualTo(PipelineRunResultDto.SUCCESS);
        assertThat(result.getStageResults()).hasSize(4);
        assertThat(result.getStageResults().get(1).getEntitiesDropped()).isEqualTo(1);

        Path anonymized = tempDir.resolve("anonymized");
        MetricSeries current = csvService.read(anonymized.resolve("1/A/AXDL.csv"), false).getSeries();
        assertThat(current.dayCount()).isEqualTo(5);
        for (DayRecord day : current.getDays()) {
            for (double value : day.getValues()) {
                assertThat(value).isNotNaN().isGreaterThanOrEqualTo(0.0);
                assertThat(SeriesValues.round(value)).isEqualTo(value);
            }
        }
        assertThat(anonymized.resolve("1/B")).doesNotExist();
        assertThat(anonymized.resolve(RunReportWriter.REPORT_FILE_NAME)).exists();
        assertThat(tempDir.resolve("published/1/A/Phase A current.csv")).exists();
        assertThat(tempDir.resolve("published/1/A/AXDY.csv")).exists();
    }

    @Test
    void testRunAll_MissingInputRoot_Fails() {
        PipelineRunResultDto result = pipeline.runAll(null);

        assertThat(result.getProcessingStatus()).isEqualTo(PipelineRunResultDto.FAILED);
        assertThat(result.getStageResults()).hasSize(1);
    }

    /**
     * Data lines for consecutive days; with gaps the second slot of each day is empty.
     */
    private static String[] days(int count, String value, boolean withGaps) {
        List<String> lines = new ArrayList<>();
        LocalDate date = LocalDate.of(2023, 5, 1);
        for (int i = 0; i < count; i++) {
            String line = constantLine(date.plusDays(i), SLOTS, value);
            if (withGaps) {
                line = line.replaceFirst("," + Pattern.quote(value) + ",", ",,");
            }
            lines.add(line);
        }
        return lines.toArray(new String[0]);
    }
}
