package teranet.mapdev.loadseries.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.model.StageName;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Optional last step: copies the anonymized tree and gives metric files readable names.
 *
 * A file whose base name starts with a configured metric code is renamed to that code's
 * display name, keeping the extension:
 * - AXDL.csv   -> Phase A current.csv
 * - AXYGGL.csv -> Phase A active power.csv
 * When several codes match, the longest one wins. Other files are copied unchanged.
 */
@Service
public class MetricFileNameService {

    private static final Logger logger = LoggerFactory.getLogger(MetricFileNameService.class);

    private final PipelineConfig pipelineConfig;

    public MetricFileNameService(PipelineConfig pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * Resolve the published file name.
     *
     * @param filename file name with or without extension
     * @return display name plus original extension, or the input when no code matches
     */
    public String resolveDisplayName(String filename) {
        int dot = filename.lastIndexOf('.');
        String baseName = dot > 0 ? filename.substring(0, dot) : filename;
        String extension = dot > 0 ? filename.substring(dot) : "";

        return codesLongestFirst().stream()
                .filter(baseName::startsWith)
                .findFirst()
                .map(code -> pipelineConfig.getPublish().getDisplayNames().get(code) + extension)
                .orElse(filename);
    }

    public StageResult run(Path inputRoot, Path outputRoot) {
        LocalDateTime start = LocalDateTime.now();
        StageResult result = new StageResult(StageName.PUBLISH.name());
        result.setInputDir(inputRoot.toString());
        result.setOutputDir(outputRoot.toString());

        List<Path> files = StageSupport.listCsvFiles(inputRoot);
        StageSupport.prepareOutputDirectory(inputRoot, outputRoot);
        logger.info("Publishing {} files from {} into {}", files.size(), inputRoot, outputRoot);

        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            Path relativeDir = inputRoot.relativize(file).getParent();
            Path targetDir = relativeDir == null ? outputRoot : outputRoot.resolve(relativeDir);
            String targetName = resolveDisplayName(file.getFileName().toString());
            Path target = targetDir.resolve(targetName);
            try {
                Files.createDirectories(targetDir);
                if (Files.exists(target)) {
                    logger.warn("{} maps onto existing file {}, overwriting", file, target);
                }
                Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                logger.debug("Published {} as {}", file, target);
                outcomes.add(new FileOutcome(file.toString()));
            } catch (IOException e) {
                logger.error("Failed to publish {}", file, e);
                outcomes.add(FileOutcome.failed(file.toString(), "I/O error: " + e.getMessage()));
            }
        }

        StageSupport.accumulate(result, outcomes, pipelineConfig.getMaxReportedIssues());
        result.setStatus(StageSupport.statusOf(result));
        result.setProcessingDurationMs(Duration.between(start, LocalDateTime.now()).toMillis());
        logger.info("Publishing finished - status: {}, files: {} ok / {} failed",
                result.getStatus(), result.getFilesSucceeded(), result.getFilesFailed());
        return result;
    }

    private List<String> codesLongestFirst() {
        Map<String, String> displayNames = pipelineConfig.getPublish().getDisplayNames();
        List<String> codes = new ArrayList<>(displayNames.keySet());
        codes.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return codes;
    }
}
