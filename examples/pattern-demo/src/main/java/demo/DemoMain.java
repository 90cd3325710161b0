package demo;

import creational.config.CreationalConfig;
import creational.demo.DemoContext;
import creational.demo.DemoReport;
import creational.demo.DemoResolver;
import creational.demo.DemoRunner;
import creational.demo.DemoScanner;
import creational.singleton.ConfigurationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every demo in the {@code demo} package and prints a report.
 *
 * <p>Configuration comes from {@code creational.yml} on the classpath; any key can be
 * overridden with a system property, for example {@code -Dcreational.race.callers=500}.
 * Exits with status 1 if any demo fails.
 */
public class DemoMain {

    private static final Logger log = LoggerFactory.getLogger(DemoMain.class);

    static final String DEMO_PACKAGE = "demo";

    public static void main(String[] args) {
        DemoReport report = runAll();
        System.out.println(report.render());
        if (!report.success()) {
            log.error("{} demo(s) failed", report.failures().size());
            System.exit(1);
        }
    }

    static DemoReport runAll() {
        CreationalConfig config = ConfigurationManager.getInstance().config();
        log.info("Running demos for '{}'", config.serviceName());

        DemoRunner runner = new DemoRunner.Builder()
                .addDemos(new DemoResolver().resolveAll(DemoScanner.scan(DEMO_PACKAGE)))
                .timeout(config.demoTimeout())
                .build();

        return runner.runAll(new DemoContext(config, System.out));
    }
}
