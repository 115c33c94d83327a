package teranet.mapdev.loadseries.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunRequestDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.PipelineStageException;
import teranet.mapdev.loadseries.model.RunDirectories;
import teranet.mapdev.loadseries.model.StageName;
import teranet.mapdev.loadseries.util.CorrelationIdUtil;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the stages in order: preprocess, filter, anonymize and, when enabled, publish.
 *
 * Configuration is validated before anything is touched. A stage that cannot run at all
 * (missing input folder, overlapping folders) stops the chain; files that fail inside a
 * stage are only counted. The summary is returned and written to the output folder.
 */
@Service
public class QualityPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(QualityPipelineService.class);

    private final PreprocessingService preprocessingService;
    private final CohortFilteringService cohortFilteringService;
    private final AnonymizationService anonymizationService;
    private final MetricFileNameService metricFileNameService;
    private final RunReportWriter reportWriter;
    private final CleaningConfig cleaningConfig;
    private final PipelineConfig pipelineConfig;

    public QualityPipelineService(PreprocessingService preprocessingService,
                                  CohortFilteringService cohortFilteringService,
                                  AnonymizationService anonymizationService,
                                  MetricFileNameService metricFileNameService,
                                  RunReportWriter reportWriter,
                                  CleaningConfig cleaningConfig,
                                  PipelineConfig pipelineConfig) {
        this.preprocessingService = preprocessingService;
        this.cohortFilteringService = cohortFilteringService;
        this.anonymizationService = anonymizationService;
        this.metricFileNameService = metricFileNameService;
        this.reportWriter = reportWriter;
        this.cleaningConfig = cleaningConfig;
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * Run every stage.
     *
     * @param request folder overrides, may be null
     * @throws teranet.mapdev.loadseries.exception.InvalidConfigurationException before any stage runs
     */
    public PipelineRunResultDto runAll(PipelineRunRequestDto request) {
        validateConfiguration();
        RunDirectories directories = RunDirectories.from(pipelineConfig, request);

        List<StageName> stages = new ArrayList<>(List.of(StageName.PREPROCESS, StageName.FILTER, StageName.ANONYMIZE));
        if (directories.isPublish()) {
            stages.add(StageName.PUBLISH);
        }
        return execute(stages, directories);
    }

    /**
     * Run a single stage with the configured folders. PUBLISH runs even when it is not
     * enabled for full runs.
     */
    public PipelineRunResultDto runStage(StageName stage) {
        validateConfiguration();
        return execute(List.of(stage), RunDirectories.from(pipelineConfig, null));
    }

    private void validateConfiguration() {
        cleaningConfig.validate();
        pipelineConfig.validate();
    }

    private PipelineRunResultDto execute(List<StageName> stages, RunDirectories directories) {
        String runId = UUID.randomUUID().toString();
        boolean boundCorrelationId = CorrelationIdUtil.bindRunIfAbsent(runId);
        LocalDateTime start = LocalDateTime.now();

        PipelineRunResultDto result = new PipelineRunResultDto();
        result.setRunId(runId);
        result.setProcessingStartTime(start);

        try {
            logger.info("Starting pipeline run {} - stages: {}, {}", runId, stages, directories);
            for (StageName stage : stages) {
                try {
                    result.getStageResults().add(runOne(stage, directories, result));
                } catch (PipelineStageException e) {
                    logger.error("Stage {} could not run: {}", stage, e.getMessage(), e);
                    StageResult failed = new StageResult(stage.name());
                    failed.setStatus(PipelineRunResultDto.FAILED);
                    failed.addIssue(e.getMessage(), Math.max(1, pipelineConfig.getMaxReportedIssues()));
                    result.getStageResults().add(failed);
                    result.setErrorMessage("Stage " + stage + " failed: " + e.getMessage());
                    break;
                }
            }

            LocalDateTime end = LocalDateTime.now();
            result.setProcessingEndTime(end);
            result.setProcessingDurationMs(Duration.between(start, end).toMillis());
            result.setProcessingStatus(overallStatus(result.getStageResults()));

            reportWriter.write(result, directories.getOutputRoot());
            logger.info("Pipeline run {} finished - status: {}, duration: {}ms",
                    runId, result.getProcessingStatus(), result.getProcessingDurationMs());
            return result;
        } finally {
            if (boundCorrelationId) {
                CorrelationIdUtil.clearCorrelationId();
            }
        }
    }

    private StageResult runOne(StageName stage, RunDirectories directories, PipelineRunResultDto result) {
        switch (stage) {
            case PREPROCESS:
                return preprocessingService.run(directories.getInputRoot(), directories.getPreprocessedRoot());
            case FILTER:
                return cohortFilteringService.run(directories.getPreprocessedRoot(), directories.getFilteredRoot());
            case ANONYMIZE:
                AnonymizationService.Outcome outcome =
                        anonymizationService.run(directories.getFilteredRoot(), directories.getOutputRoot());
                result.setCalibration(outcome.getCalibration());
                return outcome.getStageResult();
            case PUBLISH:
                return metricFileNameService.run(directories.getOutputRoot(), directories.getPublishRoot());
            default:
                throw new IllegalArgumentException("Unsupported stage: " + stage);
        }
    }

    /**
     * FAILED if any stage failed, PARTIAL_SUCCESS if any stage had failed files,
     * SUCCESS otherwise.
     */
    static String overallStatus(List<StageResult> stageResults) {
        boolean partial = false;
        for (StageResult stageResult : stageResults) {
            if (PipelineRunResultDto.FAILED.equals(stageResult.getStatus())) {
                return PipelineRunResultDto.FAILED;
            }
            if (PipelineRunResultDto.PARTIAL_SUCCESS.equals(stageResult.getStatus())) {
                partial = true;
            }
        }
        return partial ? PipelineRunResultDto.PARTIAL_SUCCESS : PipelineRunResultDto.SUCCESS;
    }
}
