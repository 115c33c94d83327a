package teranet.mapdev.loadseries.model;

import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunRequestDto;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Folders used by one run: the configured ones, with any request overrides applied.
 */
public final class RunDirectories {

    private final Path inputRoot;
    private final Path workRoot;
    private final Path outputRoot;
    private final Path publishRoot;
    private final boolean publish;

    public RunDirectories(Path inputRoot, Path workRoot, Path outputRoot, Path publishRoot, boolean publish) {
        this.inputRoot = inputRoot;
        this.workRoot = workRoot;
        this.outputRoot = outputRoot;
        this.publishRoot = publishRoot;
        this.publish = publish;
    }

    public static RunDirectories from(PipelineConfig config, PipelineRunRequestDto request) {
        PipelineRunRequestDto overrides = request != null ? request : new PipelineRunRequestDto();
        return new RunDirectories(
                Paths.get(firstNonBlank(overrides.getInputRoot(), config.getInputRoot())),
                Paths.get(firstNonBlank(overrides.getWorkRoot(), config.getWorkRoot())),
                Paths.get(firstNonBlank(overrides.getOutputRoot(), config.getOutputRoot())),
                Paths.get(firstNonBlank(overrides.getPublishRoot(), config.getPublish().getRoot())),
                overrides.getPublish() != null ? overrides.getPublish() : config.getPublish().isEnabled());
    }

    public Path getInputRoot() {
        return inputRoot;
    }

    public Path getWorkRoot() {
        return workRoot;
    }

    public Path getPreprocessedRoot() {
        return workRoot.resolve(PipelineConfig.PREPROCESSED_DIR);
    }

    public Path getFilteredRoot() {
        return workRoot.resolve(PipelineConfig.FILTERED_DIR);
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public Path getPublishRoot() {
        return publishRoot;
    }

    public boolean isPublish() {
        return publish;
    }

    private static String firstNonBlank(String override, String configured) {
        return override != null && !override.isBlank() ? override : configured;
    }

    @Override
    public String toString() {
        return "RunDirectories{input=" + inputRoot + ", work=" + workRoot + ", output=" + outputRoot
                + (publish ? ", publish=" + publishRoot : "") + "}";
    }
}
