package teranet.mapdev.loadseries.exception;

/**
 * A stage could not run at all, for example because its input folder is missing.
 * Failures of single files are counted instead and never raise this.
 */
public class PipelineStageException extends RuntimeException {

    public PipelineStageException(String message) {
        super(message);
    }

    public PipelineStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
