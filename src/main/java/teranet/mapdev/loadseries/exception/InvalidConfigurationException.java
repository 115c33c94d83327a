package teranet.mapdev.loadseries.exception;

/**
 * Thrown before a run starts when a cleaning or pipeline setting is out of range.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates an exception for a property whose value is outside its accepted range.
     */
    public static InvalidConfigurationException invalidProperty(String property, Object value, String expected) {
        return new InvalidConfigurationException(
                String.format("Invalid property '%s': got '%s', expected %s", property, value, expected));
    }
}
