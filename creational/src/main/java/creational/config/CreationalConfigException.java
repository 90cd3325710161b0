package creational.config;

/**
 * Exception thrown when configuration cannot be loaded.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>A configuration file cannot be read or parsed</li>
 * </ul>
 *
 * <p>Invalid individual values do not raise this exception; they are logged and the
 * default is kept.
 *
 * @see CreationalConfigLoader
 */
public class CreationalConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public CreationalConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public CreationalConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
