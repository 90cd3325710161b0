package creational.singleton;

import java.util.List;

/**
 * Outcome of a {@link RaceProbe} run.
 *
 * @param callers number of threads released against the accessor
 * @param distinctInstances number of distinct instances returned, compared by identity
 * @param failures exceptions thrown by the accessor, one per failed caller
 * @param elapsedNanos wall time from releasing the start gate until every caller finished
 */
public record RaceReport(
        int callers,
        int distinctInstances,
        List<Throwable> failures,
        long elapsedNanos
) {
    public RaceReport {
        failures = List.copyOf(failures);
    }

    /**
     * Returns true if every caller succeeded and all of them saw the same instance.
     */
    public boolean allSame() {
        return failures.isEmpty() && distinctInstances == 1;
    }

    @Override
    public String toString() {
        return "RaceReport{callers=" + callers +
                ", distinctInstances=" + distinctInstances +
                ", failures=" + failures.size() +
                ", elapsed_ms=" + elapsedNanos / 1_000_000 +
                '}';
    }
}
