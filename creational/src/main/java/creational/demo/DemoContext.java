package creational.demo;

import creational.config.CreationalConfig;

import java.io.PrintStream;
import java.util.Objects;

/**
 * What a demo gets to work with: the loaded configuration and the stream to print to.
 */
public final class DemoContext {

    private final CreationalConfig config;
    private final PrintStream out;

    public DemoContext(CreationalConfig config, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config");
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Returns a context with default configuration writing to standard output. */
    public static DemoContext defaults() {
        return new DemoContext(CreationalConfig.DEFAULTS, System.out);
    }

    public CreationalConfig config() { return config; }

    public PrintStream out() { return out; }
}
