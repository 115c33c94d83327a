package teranet.mapdev.loadseries.model;

/**
 * Pipeline stages in execution order.
 */
public enum StageName {
    PREPROCESS,
    FILTER,
    ANONYMIZE,
    PUBLISH
}
