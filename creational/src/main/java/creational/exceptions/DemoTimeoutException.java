package creational.exceptions;

import java.time.Duration;

/**
 * Exception thrown when a demo does not finish within its configured timeout.
 *
 * @see creational.demo.TimeoutExecutor
 */
public class DemoTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public DemoTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis()), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /** Returns the name of the operation that timed out. */
    public String getOperation() {
        return operation;
    }

    /** Returns the configured timeout that was exceeded. */
    public Duration getTimeout() {
        return timeout;
    }
}
