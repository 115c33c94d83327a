package teranet.mapdev.loadseries.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.MalformedSeriesException;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.model.SeriesReadResult;
import teranet.mapdev.loadseries.model.StageName;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * First stage: drop sparse days and fill the remaining gaps of every metric file.
 *
 * Every *.csv below the input folder is handled independently and written to the same
 * relative path under the output folder. Zeros are read as missing here. A file whose
 * rows are all dropped is still written (header only) so the cohort stage rejects its
 * transformer.
 */
@Service
public class PreprocessingService {

    private static final Logger logger = LoggerFactory.getLogger(PreprocessingService.class);

    private final SeriesCsvService csvService;
    private final RowCompletenessFilter completenessFilter;
    private final GapImputationEngine imputationEngine;
    private final PipelineConfig pipelineConfig;
    private final Executor executor;

    public PreprocessingService(SeriesCsvService csvService,
                                RowCompletenessFilter completenessFilter,
                                GapImputationEngine imputationEngine,
                                PipelineConfig pipelineConfig,
                                @Qualifier("seriesProcessingExecutor") Executor executor) {
        this.csvService = csvService;
        this.completenessFilter = completenessFilter;
        this.imputationEngine = imputationEngine;
        this.pipelineConfig = pipelineConfig;
        this.executor = executor;
    }

    /**
     * @param inputRoot  extracted files, line/transformer/metric.csv
     * @param outputRoot emptied, then filled with the completed files
     */
    public StageResult run(Path inputRoot, Path outputRoot) {
        LocalDateTime start = LocalDateTime.now();
        StageResult result = new StageResult(StageName.PREPROCESS.name());
        result.setInputDir(inputRoot.toString());
        result.setOutputDir(outputRoot.toString());

        List<Path> files = StageSupport.listCsvFiles(inputRoot);
        StageSupport.prepareOutputDirectory(inputRoot, outputRoot);
        logger.info("Preprocessing {} files from {} into {}", files.size(), inputRoot, outputRoot);

        List<Supplier<FileOutcome>> tasks = new ArrayList<>();
        for (Path file : files) {
            Path target = outputRoot.resolve(inputRoot.relativize(file));
            tasks.add(() -> processFile(file, target));
        }
        List<FileOutcome> outcomes = StageSupport.runAll(tasks, executor);

        StageSupport.accumulate(result, outcomes, pipelineConfig.getMaxReportedIssues());
        result.setStatus(StageSupport.statusOf(result));
        result.setProcessingDurationMs(Duration.between(start, LocalDateTime.now()).toMillis());

        logger.info("Preprocessing finished - status: {}, files: {} ok / {} failed, rows dropped: {}, cells imputed: {}",
                result.getStatus(), result.getFilesSucceeded(), result.getFilesFailed(),
                result.getRowsDropped(), result.getCellsImputed());
        return result;
    }

    /**
     * Read, filter, impute and write one file. Never throws; failures become the outcome.
     */
    FileOutcome processFile(Path source, Path target) {
        String name = source.toString();
        try {
            SeriesReadResult read = csvService.read(source, true);
            FileOutcome outcome = new FileOutcome(name);
            outcome.setMalformedRows(read.getSkippedRows().size());
            outcome.getIssues().addAll(read.getSkippedRows());

            RowCompletenessFilter.Result filtered = completenessFilter.filter(read.getSeries());
            outcome.setRowsDropped(filtered.getDroppedCount());

            MetricSeries completed = filtered.getSeries();
            if (filtered.isEmpty()) {
                logger.warn("{}: no row left after completeness filtering, writing header only", name);
            } else {
                GapImputationEngine.Report report = imputationEngine.impute(completed);
                completed = report.getSeries();
                outcome.setCellsImputed(report.getCellsImputed());
            }

            csvService.write(completed, target);
            logger.info("Preprocessed {} - kept {} rows, dropped {}, imputed {} cells",
                    name, completed.dayCount(), outcome.getRowsDropped(), outcome.getCellsImputed());
            return outcome;

        } catch (MalformedSeriesException e) {
            logger.warn("Skipping malformed file {}: {}", name, e.getMessage());
            return FileOutcome.failed(name, e.getMessage());
        } catch (IOException e) {
            logger.error("I/O error while preprocessing {}", name, e);
            return FileOutcome.failed(name, "I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while preprocessing {}", name, e);
            return FileOutcome.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
