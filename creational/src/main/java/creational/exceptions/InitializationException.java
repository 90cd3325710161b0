package creational.exceptions;

/**
 * Exception thrown when constructing a lazily created instance fails.
 *
 * <p>The original failure is always available through {@link #getCause()}. A holder that
 * raised this exception stays uninitialized, so the next caller retries construction.
 *
 * @see creational.singleton.SingletonHolder#get()
 */
public class InitializationException extends RuntimeException {

    private final String holderName;

    /**
     * Creates a new initialization exception.
     *
     * @param holderName name of the holder whose construction failed
     * @param message description of the failure
     * @param cause the underlying failure, may be null
     */
    public InitializationException(String holderName, String message, Throwable cause) {
        super("Failed to initialize '" + holderName + "': " + message, cause);
        this.holderName = holderName;
    }

    /**
     * Creates a new initialization exception without a cause.
     *
     * @param holderName name of the holder whose construction failed
     * @param message description of the failure
     */
    public InitializationException(String holderName, String message) {
        this(holderName, message, null);
    }

    /**
     * Returns the name of the holder whose construction failed.
     *
     * @return the holder name
     */
    public String getHolderName() {
        return holderName;
    }
}
