package demo.singleton;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.singleton.RaceProbe;
import creational.singleton.RaceReport;
import creational.singleton.SingletonHolder;
import creational.singleton.SingletonVariant;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Releases many callers at once against a fresh {@link SingletonHolder} and against the
 * thread-safe static variants, then checks they all agree on one instance.
 */
@Demo(order = 41)
public class SingletonRaceDemo implements PatternDemo {

    @Override
    public String name() {
        return "singleton/race";
    }

    @Override
    public void run(DemoContext context) throws InterruptedException {
        int callers = context.config().raceCallers();

        AtomicInteger built = new AtomicInteger();
        SingletonHolder<Object> holder = SingletonHolder.of("race-demo", () -> {
            built.incrementAndGet();
            return new Object();
        });

        report(context, "SingletonHolder", RaceProbe.race(callers, holder::get));
        if (built.get() != 1) {
            throw new IllegalStateException("SingletonHolder constructed " + built.get() + " instances");
        }

        for (SingletonVariant variant : SingletonVariant.values()) {
            if (variant.isThreadSafe()) {
                report(context, variant.name(), RaceProbe.race(callers, variant::instance));
            }
        }
    }

    private static void report(DemoContext context, String label, RaceReport report) {
        context.out().printf("%-15s %s%n", label, report);
        if (!report.allSame()) {
            throw new IllegalStateException(label + " failed the race: " + report);
        }
    }
}
