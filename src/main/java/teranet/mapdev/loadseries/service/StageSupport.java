package teranet.mapdev.loadseries.service;

import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto.StageResult;
import teranet.mapdev.loadseries.exception.PipelineStageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Folder handling and result bookkeeping shared by the stage services.
 */
final class StageSupport {

    /** Numeric folder names first in numeric order, then the rest alphabetically */
    static final Comparator<String> NUMERIC_AWARE = (a, b) -> {
        Long left = asNumber(a);
        Long right = asNumber(b);
        if (left != null && right != null) {
            int byValue = Long.compare(left, right);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return a.compareTo(b);
    };

    /** Written into every output folder a stage prepares; marks the folder as safe to clear */
    static final String OUTPUT_MARKER = ".load-series-output";

    private StageSupport() {
    }

    /**
     * All *.csv files below a folder, in path order.
     *
     * @throws PipelineStageException if the folder does not exist or cannot be walked
     */
    static List<Path> listCsvFiles(Path root) {
        requireDirectory(root);
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(StageSupport::isCsv)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineStageException("Failed to list files under " + root, e);
        }
    }

    /**
     * Direct sub-folders of a folder, sorted by name with the given order.
     */
    static List<Path> listSubdirectories(Path dir, Comparator<String> order) {
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString(), order))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineStageException("Failed to list folders under " + dir, e);
        }
    }

    /**
     * Direct *.csv children of a folder, sorted by name.
     */
    static List<Path> listCsvChildren(Path dir) throws IOException {
        try (Stream<Path> paths = Files.list(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(StageSupport::isCsv)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    static void requireDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new PipelineStageException("Input folder does not exist: " + dir);
        }
    }

    /**
     * Empty (or create) a stage's output folder. Output and input must not contain each
     * other, otherwise a stage would delete or re-read its own input. A non-empty folder is
     * only emptied when it carries the {@link #OUTPUT_MARKER} or a run summary left by an
     * earlier run.
     */
    static void prepareOutputDirectory(Path input, Path output) {
        Path in = input.toAbsolutePath().normalize();
        Path out = output.toAbsolutePath().normalize();
        if (in.startsWith(out) || out.startsWith(in)) {
            throw new PipelineStageException("Output folder " + output + " overlaps input folder " + input);
        }
        if (Files.exists(out) && !Files.isDirectory(out)) {
            throw new PipelineStageException("Output folder " + output + " is not a directory");
        }
        try {
            if (Files.exists(out)) {
                if (!isEmptyDirectory(out) && !isPipelineOwned(out)) {
                    throw new PipelineStageException("Output folder " + output
                            + " is not empty and was not created by this pipeline; refusing to clear it");
                }
                List<Path> contents;
                try (Stream<Path> paths = Files.walk(out)) {
                    contents = paths.filter(p -> !p.equals(out))
                            .sorted(Comparator.reverseOrder())
                            .collect(Collectors.toList());
                }
                for (Path path : contents) {
                    Files.delete(path);
                }
            }
            Files.createDirectories(out);
            Files.createFile(out.resolve(OUTPUT_MARKER));
        } catch (IOException e) {
            throw new PipelineStageException("Failed to prepare output folder " + output, e);
        }
    }

    private static boolean isPipelineOwned(Path dir) {
        return Files.isRegularFile(dir.resolve(OUTPUT_MARKER))
                || Files.isRegularFile(dir.resolve(RunReportWriter.REPORT_FILE_NAME));
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children.findAny().isEmpty();
        }
    }

    static boolean isCsv(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    /**
     * Submit one task per item and wait for all of them, returning results in
     * submission order.
     */
    static <T> List<T> runAll(List<Supplier<T>> tasks, Executor executor) {
        List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
        for (Supplier<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(task, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    /**
     * Fold per-file outcomes into a stage result.
     */
    static void accumulate(StageResult result, List<FileOutcome> outcomes, int maxIssues) {
        for (FileOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                result.setFilesSucceeded(result.getFilesSucceeded() + 1);
            } else {
                result.setFilesFailed(result.getFilesFailed() + 1);
                result.addIssue(outcome.getFile() + ": " + outcome.getErrorMessage(), maxIssues);
            }
            result.setRowsDropped(result.getRowsDropped() + outcome.getRowsDropped());
            result.setMalformedRowsSkipped(result.getMalformedRowsSkipped() + outcome.getMalformedRows());
            result.setCellsImputed(result.getCellsImputed() + outcome.getCellsImputed());
            result.setOutliersCorrected(result.getOutliersCorrected() + outcome.getOutliersCorrected());
            for (String issue : outcome.getIssues()) {
                result.addIssue(issue, maxIssues);
            }
        }
    }

    /**
     * SUCCESS without file failures, FAILED when nothing succeeded, PARTIAL_SUCCESS otherwise.
     */
    static String statusOf(StageResult result) {
        if (result.getFilesFailed() == 0) {
            return PipelineRunResultDto.SUCCESS;
        }
        if (result.getFilesSucceeded() == 0) {
            return PipelineRunResultDto.FAILED;
        }
        return PipelineRunResultDto.PARTIAL_SUCCESS;
    }

    private static Long asNumber(String name) {
        if (name.isEmpty() || !name.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.parseLong(name);
        } catch (NumberFormatException e) {
            // longer than a long; order it with the other names
            return null;
        }
    }
}
