package teranet.mapdev.loadseries.util;

import org.slf4j.MDC;

/**
 * Keeps the correlation id of the current request or pipeline run in the SLF4J MDC so
 * every log line of a run can be traced back to it.
 *
 * HTTP requests get one from CorrelationIdFilter; runs started at boot use their run id.
 */
public final class CorrelationIdUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final String NONE = "NO-CORRELATION-ID";

    private CorrelationIdUtil() {
    }

    /**
     * @return correlation ID or "NO-CORRELATION-ID" if not set
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : NONE;
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Removes correlation ID from MDC. Call this in finally blocks.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }

    /**
     * Use the run id as correlation id unless a request already set one.
     *
     * @return true when this call set the id, so the caller must clear it afterwards
     */
    public static boolean bindRunIfAbsent(String runId) {
        if (hasCorrelationId()) {
            return false;
        }
        setCorrelationId(runId);
        return true;
    }
}
