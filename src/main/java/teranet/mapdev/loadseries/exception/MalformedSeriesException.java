package teranet.mapdev.loadseries.exception;

/**
 * Raised when a metric file does not have the expected layout: a date column followed by
 * exactly one column per slot. The stage that reads the file skips it and carries on.
 */
public class MalformedSeriesException extends RuntimeException {

    public MalformedSeriesException(String message) {
        super(message);
    }

    public MalformedSeriesException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception for a header whose column count does not match the slot count.
     */
    public static MalformedSeriesException wrongColumnCount(String label, int expected, int actual) {
        return new MalformedSeriesException(
                String.format("%s: expected 1 date column and %d value columns, but header has %d columns",
                        label, expected, actual));
    }
}
