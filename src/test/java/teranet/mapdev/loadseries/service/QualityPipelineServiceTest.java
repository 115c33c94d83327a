package teranet.mapdev.loadseries.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunRequestDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.Calibration;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.InvalidConfigurationException;
import teranet.mapdev.loadseries.exception.PipelineStageException;
import teranet.mapdev.loadseries.model.StageName;
import teranet.mapdev.loadseries.util.CorrelationIdUtil;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QualityPipelineService orchestration
 */
@ExtendWith(MockitoExtension.class)
class QualityPipelineServiceTest {

    @Mock
    private PreprocessingService preprocessingService;

    @Mock
    private CohortFilteringService cohortFilteringService;

    @Mock
    private AnonymizationService anonymizationService;

    @Mock
    private MetricFileNameService metricFileNameService;

    @Mock
    private RunReportWriter reportWriter;

    private CleaningConfig cleaningConfig;
    private PipelineConfig pipelineConfig;
    private QualityPipelineService service;

    @BeforeEach
    void setUp() {
        MDC.clear();
        cleaningConfig = new CleaningConfig();
        pipelineConfig = new PipelineConfig();
        pipelineConfig.setInputRoot("in");
        pipelineConfig.setWorkRoot("work");
        pipelineConfig.setOutputRoot("out");
        pipelineConfig.getPublish().setRoot("pub");
        service = new QualityPipelineService(preprocessingService, cohortFilteringService, anonymizationService,
                metricFileNameService, reportWriter, cleaningConfig, pipelineConfig);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testRunAll_RunsStagesInOrderOnChainedFolders() {
        // Given
        when(preprocessingService.run(any(), any())).thenReturn(stage("PREPROCESS", PipelineRunResultDto.SUCCESS));
        when(cohortFilteringService.run(any(), any())).thenReturn(stage("FILTER", PipelineRunResultDto.SUCCESS));
        Calibration calibration = new Calibration(1, 2, 3, 0.05, 0.02, 0.06, 0.02);
        when(anonymizationService.run(any(), any())).thenReturn(
                new AnonymizationService.Outcome(stage("ANONYMIZE", PipelineRunResultDto.SUCCESS), calibration));

        // When
        PipelineRunResultDto result = service.runAll(null);

        // Then
        InOrder order = inOrder(preprocessingService, cohortFilteringService, anonymizationService, reportWriter);
        order.verify(preprocessingService).run(Paths.get("in"), Paths.get("work", "preprocessed"));
        order.verify(cohortFilteringService).run(Paths.get("work", "preprocessed"), Paths.get("work", "filtered"));
        order.verify(anonymizationService).run(Paths.get("work", "filtered"), Paths.get("out"));
        order.verify(reportWriter).write(result, Paths.get("out"));
        verifyNoInteractions(metricFileNameService);

        assertThat(result.getProcessingStatus()).isEqualTo(PipelineRunResultDto.SUCCESS);
        assertThat(result.getStageResults()).extracting(StageResult::getStage)
                .containsExactly("PREPROCESS", "FILTER", "ANONYMIZE");
        assertThat(result.getCalibration()).isSameAs(calibration);
        assertThat(result.getRunId()).isNotBlank();
    }

    @Test
    void testRunAll_StageFailureStopsChain() {
        when(preprocessingService.run(any(), any())).thenReturn(stage("PREPROCESS", PipelineRunResultDto.SUCCESS));
        when(cohortFilteringService.run(any(), any())).thenThrow(new PipelineStageException("Input folder does not exist: x"));

        PipelineRunResultDto result = service.runAll(null);

        verifyNoInteractions(anonymizationService);
        assertThat(result.getProcessingStatus()).isEqualTo(PipelineRunResultDto.FAILED);
        assertThat(result.getStageResults()).hasSize(2);
        assertThat(result.getStageResults().get(1).getIssues()).containsExactly("Input folder does not exist: x");
        assertThat(result.getErrorMessage()).contains("FILTER");
    }

    @Test
    void testRunAll_PartialStageMakesRunPartial() {
        when(preprocessingService.run(any(), any()))
                .thenReturn(stage("PREPROCESS", PipelineRunResultDto.PARTIAL_SUCCESS));
        when(cohortFilteringService.run(any(), any())).thenReturn(stage("FILTER", PipelineRunResultDto.SUCCESS));
        when(anonymizationService.run(any(), any())).thenReturn(
                new AnonymizationService.Outcome(stage("ANONYMIZE", PipelineRunResultDto.SUCCESS), null));

        assertThat(service.runAll(null).getProcessingStatus()).isEqualTo(PipelineRunResultDto.PARTIAL_SUCCESS);
    }

    @Test
    void testRunAll_RequestOverridesAndPublish() {
        when(preprocessingService.run(any(), any())).thenReturn(stage("PREPROCESS", PipelineRunResultDto.SUCCESS));
        when(cohortFilteringService.run(any(), any())).thenReturn(stage("FILTER", PipelineRunResultDto.SUCCESS));
        when(anonymizationService.run(any(), any())).thenReturn(
                new AnonymizationService.Outcome(stage("ANONYMIZE", PipelineRunResultDto.SUCCESS), null));
        when(metricFileNameService.run(any(), any())).thenReturn(stage("PUBLISH", PipelineRunResultDto.SUCCESS));
        PipelineRunRequestDto request = new PipelineRunRequestDto("other-in", null, "other-out", true, null);

        service.runAll(request);

        verify(preprocessingService).run(Paths.get("other-in"), Paths.get("work", "preprocessed"));
        verify(metricFileNameService).run(Paths.get("other-out"), Paths.get("pub"));
    }

    @Test
    void testRunAll_InvalidConfiguration_NothingRuns() {
        cleaningConfig.getCompleteness().setThreshold(-0.1);

        assertThatThrownBy(() -> service.runAll(null)).isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(preprocessingService, reportWriter);
    }

    @Test
    void testRunStage_PublishRunsEvenWhenDisabled() {
        when(metricFileNameService.run(any(), any())).thenReturn(stage("PUBLISH", PipelineRunResultDto.SUCCESS));

        PipelineRunResultDto result = service.runStage(StageName.PUBLISH);

        verify(metricFileNameService).run(Paths.get("out"), Paths.get("pub"));
        verifyNoInteractions(preprocessingService, cohortFilteringService, anonymizationService);
        assertThat(result.getStageResults()).hasSize(1);
    }

    @Test
    void testRun_BindsAndClearsRunCorrelationId() {
        String[] seen = new String[1];
        when(preprocessingService.run(any(), any())).thenAnswer(invocation -> {
            seen[0] = CorrelationIdUtil.getCurrentCorrelationId();
            return stage("PREPROCESS", PipelineRunResultDto.SUCCESS);
        });

        PipelineRunResultDto result = service.runStage(StageName.PREPROCESS);

        assertThat(seen[0]).isEqualTo(result.getRunId());
        assertThat(CorrelationIdUtil.hasCorrelationId()).isFalse();
    }

    @Test
    void testOverallStatus() {
        assertThat(QualityPipelineService.overallStatus(List.of())).isEqualTo(PipelineRunResultDto.SUCCESS);
        assertThat(QualityPipelineService.overallStatus(List.of(
                stage("A", PipelineRunResultDto.PARTIAL_SUCCESS),
                stage("B", PipelineRunResultDto.FAILED)))).isEqualTo(PipelineRunResultDto.FAILED);
    }

    private static StageResult stage(String name, String status) {
        StageResult result = new StageResult(name);
        result.setStatus(status);
        return result;
    }
}
