package creational.demo;

import creational.exceptions.DemoTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an operation on a worker thread and gives up on it after a timeout.
 *
 * <p>A null, zero or negative timeout disables the limit and the operation runs on the
 * calling thread. A timed-out operation is interrupted, though it may ignore the interrupt.
 *
 * @see DemoTimeoutException
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    // daemon threads so a stuck demo never keeps the JVM alive
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "demo-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
    }

    /**
     * Returns true if the timeout actually limits execution.
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Executes a callable with a timeout, passing its checked exceptions through unchanged.
     *
     * @param operation name used in logs and in the timeout message
     * @param timeout the limit, or null/zero for none
     * @param callable the operation to execute
     * @param <T> the return type
     * @return the result of the callable
     * @throws DemoTimeoutException if the operation times out
     * @throws Exception whatever the callable throws
     */
    public static <T> T executeWithTimeoutChecked(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return callable.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, EXECUTOR);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new DemoTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DemoTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new RuntimeException("Operation '" + operation + "' failed", cause);
            }
        }
    }

    /**
     * Executes a void action that may throw checked exceptions with a timeout.
     *
     * @param operation name used in logs and in the timeout message
     * @param timeout the limit, or null/zero for none
     * @param action the operation to execute
     * @throws DemoTimeoutException if the operation times out
     * @throws Exception whatever the action throws
     */
    public static void executeWithTimeoutChecked(String operation, Duration timeout, CheckedRunnable action) throws Exception {
        executeWithTimeoutChecked(operation, timeout, () -> {
            action.run();
            return null;
        });
    }

    /**
     * A runnable that can throw checked exceptions.
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }
}
