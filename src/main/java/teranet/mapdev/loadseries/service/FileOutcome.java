package teranet.mapdev.loadseries.service;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of processing one file inside a stage. Built on the worker thread and only
 * read by the calling thread after the task has been joined.
 */
@Data
class FileOutcome {

    private final String file;
    private boolean success = true;
    private String errorMessage;
    private long rowsDropped;
    private long malformedRows;
    private long cellsImputed;
    private long outliersCorrected;
    private final List<String> issues = new ArrayList<>();

    static FileOutcome failed(String file, String errorMessage) {
        FileOutcome outcome = new FileOutcome(file);
        outcome.setSuccess(false);
        outcome.setErrorMessage(errorMessage);
        return outcome;
    }
}
