package teranet.mapdev.loadseries.service;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.Calibration;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.MalformedSeriesException;
import teranet.mapdev.loadseries.model.GlobalDispersionStats;
import teranet.mapdev.loadseries.model.MetricCategory;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.model.StageName;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Third stage: perturb every filtered file with calibrated noise.
 *
 * Pass 1 summarizes all files and builds the dispersion constants; only after every
 * pass-1 task has finished does pass 2 start writing perturbed copies. Files that fail
 * in pass 1 are left out of both passes.
 */
@Service
public class AnonymizationService {

    private static final Logger logger = LoggerFactory.getLogger(AnonymizationService.class);

    private final SeriesCsvService csvService;
    private final MetricCategoryClassifier classifier;
    private final NoiseCalibrator calibrator;
    private final NoiseInjector injector;
    private final CleaningConfig cleaningConfig;
    private final PipelineConfig pipelineConfig;
    private final Executor executor;

    public AnonymizationService(SeriesCsvService csvService,
                                MetricCategoryClassifier classifier,
                                NoiseCalibrator calibrator,
                                NoiseInjector injector,
                                CleaningConfig cleaningConfig,
                                PipelineConfig pipelineConfig,
                                @Qualifier("seriesProcessingExecutor") Executor executor) {
        this.csvService = csvService;
        this.classifier = classifier;
        this.calibrator = calibrator;
        this.injector = injector;
        this.cleaningConfig = cleaningConfig;
        this.pipelineConfig = pipelineConfig;
        this.executor = executor;
    }

    /**
     * Run both passes.
     *
     * @return the stage counters plus the calibration that was applied
     */
    public Outcome run(Path inputRoot, Path outputRoot) {
        LocalDateTime start = LocalDateTime.now();
        StageResult result = new StageResult(StageName.ANONYMIZE.name());
        result.setInputDir(inputRoot.toString());
        result.setOutputDir(outputRoot.toString());
        int maxIssues = pipelineConfig.getMaxReportedIssues();
        boolean noiseEnabled = cleaningConfig.getNoise().isEnabled();

        List<Path> files = StageSupport.listCsvFiles(inputRoot);
        StageSupport.prepareOutputDirectory(inputRoot, outputRoot);
        logger.info("Anonymizing {} files from {} into {} (noise {})",
                files.size(), inputRoot, outputRoot, noiseEnabled ? "enabled" : "disabled");

        // Pass 1: calibration
        List<Supplier<CalibrationRead>> readTasks = new ArrayList<>();
        for (Path file : files) {
            readTasks.add(() -> summarize(file));
        }
        List<CalibrationRead> reads = StageSupport.runAll(readTasks, executor);

        List<NoiseCalibrator.PartialSummary> partials = new ArrayList<>();
        List<Path> readable = new ArrayList<>();
        List<FileOutcome> failures = new ArrayList<>();
        for (CalibrationRead read : reads) {
            if (read.summary != null) {
                partials.add(read.summary);
                readable.add(read.file);
            } else {
                failures.add(read.failure);
            }
        }
        StageSupport.accumulate(result, failures, maxIssues);

        GlobalDispersionStats stats = calibrator.calibrate(partials);
        Calibration calibration = describe(stats);
        logger.info("Dispersion constants - current: {}, voltage: {}, power: {}",
                stats.getCurrentStd(), stats.getVoltageStd(), stats.getPowerStd());
        if (noiseEnabled) {
            logger.info("Noise sigma - current: {}, voltage: {}, power: {}, unknown: {}",
                    calibration.getCurrentNoiseSigma(), calibration.getVoltageNoiseSigma(),
                    calibration.getPowerNoiseSigma(), calibration.getUnknownNoiseSigma());
        }

        // Pass 2: injection, submitted only once the stats are final
        AtomicInteger processed = new AtomicInteger();
        int total = readable.size();
        List<Supplier<FileOutcome>> writeTasks = new ArrayList<>();
        for (Path file : readable) {
            Path relative = inputRoot.relativize(file);
            Path target = outputRoot.resolve(relative);
            writeTasks.add(() -> {
                FileOutcome outcome = perturbFile(file, target, relative.toString(), stats, noiseEnabled);
                logger.info("processed {}/{}: {}", processed.incrementAndGet(), total, relative);
                return outcome;
            });
        }
        List<FileOutcome> written = StageSupport.runAll(writeTasks, executor);
        StageSupport.accumulate(result, written, maxIssues);

        result.setStatus(StageSupport.statusOf(result));
        result.setProcessingDurationMs(Duration.between(start, LocalDateTime.now()).toMillis());
        logger.info("Anonymization finished - status: {}, files: {} ok / {} failed",
                result.getStatus(), result.getFilesSucceeded(), result.getFilesFailed());
        return new Outcome(result, calibration);
    }

    private CalibrationRead summarize(Path file) {
        try {
            MetricSeries series = csvService.read(file, false).getSeries();
            return new CalibrationRead(file, calibrator.summarize(series), null);
        } catch (MalformedSeriesException | IOException e) {
            logger.warn("Skipping {} in calibration: {}", file, e.getMessage());
            return new CalibrationRead(file, null, FileOutcome.failed(file.toString(), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Unexpected error while reading {} for calibration", file, e);
            return new CalibrationRead(file, null,
                    FileOutcome.failed(file.toString(), e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private FileOutcome perturbFile(Path source, Path target, String relative, GlobalDispersionStats stats,
            boolean noiseEnabled) {
        try {
            MetricSeries series = csvService.read(source, false).getSeries();
            MetricSeries output;
            if (noiseEnabled) {
                MetricCategory category = classifier.classify(series.getLabel());
                output = injector.inject(series, category, stats, randomFor(relative));
            } else {
                output = series.deepCopy();
                SeriesValues.roundInPlace(output.valueMatrix());
            }
            csvService.write(output, target);
            return new FileOutcome(source.toString());
        } catch (MalformedSeriesException | IOException e) {
            logger.error("Failed to anonymize {}: {}", source, e.getMessage());
            return FileOutcome.failed(source.toString(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error while anonymizing {}", source, e);
            return FileOutcome.failed(source.toString(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * One generator per file so results do not depend on thread scheduling. With a
     * configured seed the stream is derived from the seed and the file's relative path.
     */
    RandomGenerator randomFor(String relativePath) {
        Long seed = cleaningConfig.getNoise().getSeed();
        if (seed == null) {
            return new MersenneTwister();
        }
        return new MersenneTwister(seed * 31 + relativePath.replace('\\', '/').hashCode());
    }

    private Calibration describe(GlobalDispersionStats stats) {
        return new Calibration(
                stats.getCurrentStd(),
                stats.getVoltageStd(),
                stats.getPowerStd(),
                injector.sigma(MetricCategory.CURRENT, stats),
                injector.sigma(MetricCategory.VOLTAGE, stats),
                injector.sigma(MetricCategory.POWER, stats),
                injector.sigma(MetricCategory.UNKNOWN, stats));
    }

    private static class CalibrationRead {
        final Path file;
        final NoiseCalibrator.PartialSummary summary;
        final FileOutcome failure;

        CalibrationRead(Path file, NoiseCalibrator.PartialSummary summary, FileOutcome failure) {
            this.file = file;
            this.summary = summary;
            this.failure = failure;
        }
    }

    /**
     * Stage counters plus the applied calibration.
     */
    public static class Outcome {
        private final StageResult stageResult;
        private final Calibration calibration;

        public Outcome(StageResult stageResult, Calibration calibration) {
            this.stageResult = stageResult;
            this.calibration = calibration;
        }

        public StageResult getStageResult() {
            return stageResult;
        }

        public Calibration getCalibration() {
            return calibration;
        }
    }
}
