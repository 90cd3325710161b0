package creational.demo;

/**
 * A self-contained demonstration of one creational pattern.
 *
 * <p>Implementations write their user-facing output to {@link DemoContext#out()}. Throwing
 * from {@link #run(DemoContext)} marks the demo as failed; other demos still run.
 *
 * @see Demo
 * @see DemoRunner
 */
public interface PatternDemo {

    /**
     * Returns the name shown in the report.
     */
    String name();

    /**
     * Runs the demonstration.
     *
     * @param context configuration and output stream for this run
     * @throws Exception if the demonstration fails
     */
    void run(DemoContext context) throws Exception;
}
