package teranet.mapdev.loadseries.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.MalformedSeriesException;
import teranet.mapdev.loadseries.model.CohortDecision;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.model.SeriesReadResult;
import teranet.mapdev.loadseries.model.StageName;
import teranet.mapdev.loadseries.model.TransformerCohort;
import teranet.mapdev.loadseries.util.AnonymousCodeGenerator;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Second stage: keep transformers whose files share enough valid days, renumber the
 * survivors and clean outliers.
 *
 * Input layout is line/transformer/metric.csv. Lines are visited in numeric order,
 * transformers alphabetically; surviving lines become 1, 2, ... and surviving
 * transformers of a line A, B, ... in that same order. A line without survivors is
 * dropped. Outlier correction runs here and nowhere else.
 */
@Service
public class CohortFilteringService {

    private static final Logger logger = LoggerFactory.getLogger(CohortFilteringService.class);

    private final SeriesCsvService csvService;
    private final CohortValidityFilter validityFilter;
    private final OutlierCorrector outlierCorrector;
    private final CleaningConfig cleaningConfig;
    private final PipelineConfig pipelineConfig;
    private final Executor executor;

    public CohortFilteringService(SeriesCsvService csvService,
                                  CohortValidityFilter validityFilter,
                                  OutlierCorrector outlierCorrector,
                                  CleaningConfig cleaningConfig,
                                  PipelineConfig pipelineConfig,
                                  @Qualifier("seriesProcessingExecutor") Executor executor) {
        this.csvService = csvService;
        this.validityFilter = validityFilter;
        this.outlierCorrector = outlierCorrector;
        this.cleaningConfig = cleaningConfig;
        this.pipelineConfig = pipelineConfig;
        this.executor = executor;
    }

    public StageResult run(Path inputRoot, Path outputRoot) {
        LocalDateTime start = LocalDateTime.now();
        StageResult result = new StageResult(StageName.FILTER.name());
        result.setInputDir(inputRoot.toString());
        result.setOutputDir(outputRoot.toString());
        int maxIssues = pipelineConfig.getMaxReportedIssues();

        StageSupport.requireDirectory(inputRoot);
        List<Path> lineDirs = StageSupport.listSubdirectories(inputRoot, StageSupport.NUMERIC_AWARE);
        StageSupport.prepareOutputDirectory(inputRoot, outputRoot);
        logger.info("Filtering {} lines from {} (min valid days: {}, outlier cleaning: {})",
                lineDirs.size(), inputRoot, cleaningConfig.getCohort().getMinValidDays(),
                cleaningConfig.getOutlier().isEnabled());

        List<Supplier<FileOutcome>> writeTasks = new ArrayList<>();
        int survivingLines = 0;

        for (Path lineDir : lineDirs) {
            List<Path> entityDirs = StageSupport.listSubdirectories(lineDir, Comparator.naturalOrder());
            List<Supplier<EntityOutcome>> entityTasks = new ArrayList<>();
            for (Path entityDir : entityDirs) {
                entityTasks.add(() -> evaluateEntity(lineDir, entityDir));
            }
            List<EntityOutcome> entities = StageSupport.runAll(entityTasks, executor);

            List<TransformerCohort> survivors = new ArrayList<>();
            for (EntityOutcome entity : entities) {
                StageSupport.accumulate(result, entity.failures, maxIssues);
                result.setMalformedRowsSkipped(result.getMalformedRowsSkipped() + entity.malformedRows);
                if (entity.retained != null) {
                    survivors.add(entity.retained);
                } else {
                    result.setEntitiesDropped(result.getEntitiesDropped() + 1);
                    result.addIssue(entity.name + " dropped: " + entity.dropReason, maxIssues);
                }
            }

            if (survivors.isEmpty()) {
                logger.warn("Line {} dropped: no transformer passed the cohort check", lineDir.getFileName());
                result.setLinesDropped(result.getLinesDropped() + 1);
                continue;
            }

            String lineCode = AnonymousCodeGenerator.lineCode(survivingLines++);
            List<String> survivorNames = new ArrayList<>();
            for (TransformerCohort cohort : survivors) {
                survivorNames.add(cohort.getTransformerCode());
            }
            Map<String, String> transformerCodes = AnonymousCodeGenerator.assignTransformerCodes(survivorNames);
            for (TransformerCohort cohort : survivors) {
                String transformerCode = transformerCodes.get(cohort.getTransformerCode());
                logger.info("{}/{} -> {}/{} ({} files)", cohort.getLineCode(), cohort.getTransformerCode(),
                        lineCode, transformerCode, cohort.getSeries().size());
                Path targetDir = outputRoot.resolve(lineCode).resolve(transformerCode);
                for (MetricSeries series : cohort.getSeries().values()) {
                    writeTasks.add(() -> correctAndWrite(series, targetDir.resolve(series.getLabel()),
                            lineCode + "/" + transformerCode));
                }
            }
            result.setEntitiesRetained(result.getEntitiesRetained() + survivors.size());
        }
        result.setLinesRetained(survivingLines);

        List<FileOutcome> written = StageSupport.runAll(writeTasks, executor);
        StageSupport.accumulate(result, written, maxIssues);
        result.setStatus(StageSupport.statusOf(result));
        result.setProcessingDurationMs(Duration.between(start, LocalDateTime.now()).toMillis());

        logger.info("Filtering finished - status: {}, lines: {} kept / {} dropped, transformers: {} kept / {} dropped, outliers corrected: {}",
                result.getStatus(), result.getLinesRetained(), result.getLinesDropped(),
                result.getEntitiesRetained(), result.getEntitiesDropped(), result.getOutliersCorrected());
        return result;
    }

    /**
     * Read every file of one transformer and decide whether it survives.
     * Any unreadable file drops the whole transformer.
     */
    EntityOutcome evaluateEntity(Path lineDir, Path entityDir) {
        String lineName = lineDir.getFileName().toString();
        String entityName = entityDir.getFileName().toString();
        EntityOutcome outcome = new EntityOutcome(lineName + "/" + entityName);

        List<Path> files;
        try {
            files = StageSupport.listCsvChildren(entityDir);
        } catch (IOException e) {
            logger.error("Cannot list files of {}", outcome.name, e);
            outcome.dropReason = "cannot list files: " + e.getMessage();
            return outcome;
        }

        Map<String, MetricSeries> series = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                SeriesReadResult read = csvService.read(file, false);
                outcome.malformedRows += read.getSkippedRows().size();
                series.put(read.getSeries().getLabel(), read.getSeries());
            } catch (MalformedSeriesException | IOException e) {
                logger.warn("{}: unreadable file {}: {}", outcome.name, file.getFileName(), e.getMessage());
                outcome.failures.add(FileOutcome.failed(file.toString(), e.getMessage()));
            }
        }
        if (!outcome.failures.isEmpty()) {
            outcome.dropReason = outcome.failures.size() + " unreadable metric file(s)";
            return outcome;
        }

        TransformerCohort cohort = new TransformerCohort(lineName, entityName, series);
        CohortDecision decision = validityFilter.evaluate(cohort);
        if (!decision.isRetained()) {
            logger.warn("Transformer {} dropped: {}", outcome.name, decision.getReason());
            outcome.dropReason = decision.getReason();
            return outcome;
        }
        logger.debug("Transformer {} kept with {} common valid days", outcome.name, decision.getCommonDates().size());
        outcome.retained = validityFilter.apply(cohort, decision);
        return outcome;
    }

    private FileOutcome correctAndWrite(MetricSeries series, Path target, String entityCode) {
        FileOutcome outcome = new FileOutcome(target.toString());
        try {
            if (cleaningConfig.getOutlier().isEnabled()) {
                int corrected = outlierCorrector.correct(series);
                outcome.setOutliersCorrected(corrected);
                logger.info("{} {}: corrected {} outlier points", entityCode, series.getLabel(), corrected);
            }
            csvService.write(series, target);
            return outcome;
        } catch (IOException e) {
            logger.error("Failed to write {}", target, e);
            return FileOutcome.failed(target.toString(), "I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while writing {}", target, e);
            return FileOutcome.failed(target.toString(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Cohort decision of one transformer folder.
     */
    static class EntityOutcome {
        final String name;
        TransformerCohort retained;
        String dropReason;
        long malformedRows;
        final List<FileOutcome> failures = new ArrayList<>();

        EntityOutcome(String name) {
            this.name = name;
        }
    }
}
