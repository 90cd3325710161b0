package creational.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Runs a list of {@link PatternDemo}s and collects their outcomes into a {@link DemoReport}.
 *
 * <p>Demos run one after another on the calling thread, or on a worker thread when a
 * timeout is set. Each demo is isolated: a failure in one does not stop the rest.
 *
 * <h2>Usage:</h2>
 * <pre>
 * DemoRunner runner = new DemoRunner.Builder()
 *     .addDemos(new DemoResolver().resolveAll(DemoScanner.scan("demo")))
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 *
 * DemoReport report = runner.runAll(context);
 * </pre>
 */
public class DemoRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private final List<PatternDemo> demos;
    private final Duration timeout;

    private DemoRunner(List<PatternDemo> demos, Duration timeout) {
        this.demos = List.copyOf(demos);
        this.timeout = timeout;
    }

    /**
     * Runs every demo.
     *
     * @param context passed to each demo
     * @return a report with one result per demo, in run order
     */
    public DemoReport runAll(DemoContext context) {
        List<DemoResult> results = new ArrayList<>();
        for (int i = 0; i < demos.size(); i++) {
            results.add(runOne(demos.get(i), i, context));
        }
        return new DemoReport(results);
    }

    private DemoResult runOne(PatternDemo demo, int index, DemoContext context) {
        String name = nameOf(demo, index);
        log.info("Running demo '{}'", name);
        long start = System.nanoTime();
        try {
            TimeoutExecutor.executeWithTimeoutChecked(name, timeout, () -> demo.run(context));
            return DemoResult.ok(name, elapsedMillis(start));
        } catch (Exception e) {
            log.warn("Demo '{}' failed", name, e);
            return DemoResult.fail(name, "threw: " + e.getMessage(), e, elapsedMillis(start));
        }
    }

    private static String nameOf(PatternDemo demo, int index) {
        String name;
        try {
            name = demo.name();
        } catch (RuntimeException e) {
            log.warn("Demo #{} failed to report its name", index, e);
            name = null;
        }
        return name == null || name.isBlank() ? "demo#" + index : name;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * Builder for constructing {@link DemoRunner} instances.
     */
    public static final class Builder {
        private final List<PatternDemo> demos = new ArrayList<>();
        private Duration timeout = Duration.ZERO;

        /**
         * Adds a demo to the runner.
         *
         * @param demo the demo to add
         * @return this builder for method chaining
         */
        public Builder addDemo(PatternDemo demo) {
            this.demos.add(Objects.requireNonNull(demo, "demo"));
            return this;
        }

        public Builder addDemos(Collection<? extends PatternDemo> demos) {
            demos.forEach(this::addDemo);
            return this;
        }

        /**
         * Limits how long each demo may run. Zero or null means no limit.
         *
         * @param timeout the per-demo limit
         * @return this builder for method chaining
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout == null ? Duration.ZERO : timeout;
            return this;
        }

        public DemoRunner build() {
            return new DemoRunner(demos, timeout);
        }
    }
}
