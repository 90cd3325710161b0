package creational.demo;

/**
 * Immutable outcome of running one demo.
 *
 * <p>Use {@link #ok(String, long)} and {@link #fail(String, String, Throwable, long)}
 * to create instances.
 */
public final class DemoResult {

    private final String name;
    private final boolean ok;
    private final String message;
    private final Throwable error;
    private final long elapsedMillis;

    private DemoResult(String name, boolean ok, String message, Throwable error, long elapsedMillis) {
        this.name = name;
        this.ok = ok;
        this.message = message;
        this.error = error;
        this.elapsedMillis = elapsedMillis;
    }

    public static DemoResult ok(String name, long elapsedMillis) {
        return new DemoResult(name, true, null, null, elapsedMillis);
    }

    /**
     * Creates a failed result.
     *
     * @param name the demo name
     * @param message the failure message
     * @param error the exception that caused the failure (may be null)
     * @param elapsedMillis how long the demo ran
     * @return a failed result
     */
    public static DemoResult fail(String name, String message, Throwable error, long elapsedMillis) {
        return new DemoResult(name, false, message, error, elapsedMillis);
    }

    /** Returns the demo name. */
    public String name() { return name; }

    /** Returns true if the demo completed without throwing. */
    public boolean isOk() { return ok; }

    /** Returns the failure message, or null if the demo passed. */
    public String message() { return message; }

    /** Returns the exception that caused the failure, or null if none. */
    public Throwable error() { return error; }

    public long elapsedMillis() { return elapsedMillis; }

    @Override
    public String toString() {
        return ok
                ? String.format("[ OK ] %s (%d ms)", name, elapsedMillis)
                : String.format("[FAIL] %s (%d ms): %s", name, elapsedMillis, message);
    }
}
