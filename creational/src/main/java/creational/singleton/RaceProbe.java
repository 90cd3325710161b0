package creational.singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Releases many threads against an accessor at the same moment and reports what they saw.
 *
 * <p>Every caller thread is started and parked on a shared start gate before any of them
 * calls the accessor, which maximizes contention on the first access.
 *
 * <h2>Usage:</h2>
 * <pre>
 * SingletonHolder&lt;Cache&gt; holder = SingletonHolder.of("cache", Cache::new);
 * RaceReport report = RaceProbe.race(100, holder::get);
 * assert report.allSame();
 * </pre>
 */
public final class RaceProbe {

    private static final Logger log = LoggerFactory.getLogger(RaceProbe.class);

    private RaceProbe() {
        // Utility class
    }

    /**
     * Calls {@code accessor} once from each of {@code callers} threads, all released together.
     *
     * @param callers number of concurrent callers, must be positive
     * @param accessor the accessor under test
     * @return the identities and failures observed
     * @throws InterruptedException if interrupted while waiting for the callers
     */
    public static RaceReport race(int callers, Supplier<?> accessor) throws InterruptedException {
        AtomicInteger seq = new AtomicInteger();
        return race(callers, accessor, r -> {
            Thread t = new Thread(r, "race-caller-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Same as {@link #race(int, Supplier)} with caller threads made by {@code threadFactory}.
     *
     * <p>If a caller cannot be started, or the calling thread is interrupted before the race
     * begins, the callers already started are released without touching the accessor and
     * the failure is rethrown.
     */
    static RaceReport race(int callers, Supplier<?> accessor, ThreadFactory threadFactory) throws InterruptedException {
        if (callers <= 0) {
            throw new IllegalArgumentException("callers must be positive: " + callers);
        }

        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(callers);
        AtomicBoolean aborted = new AtomicBoolean();

        Object[] results = new Object[callers];
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        int started = 0;
        long startNanos;
        try {
            for (; started < callers; started++) {
                final int slot = started;
                Thread t = threadFactory.newThread(() -> {
                    ready.countDown();
                    try {
                        start.await();
                        if (!aborted.get()) {
                            results[slot] = accessor.get();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        failures.add(e);
                    } catch (RuntimeException | Error e) {
                        failures.add(e);
                    } finally {
                        done.countDown();
                    }
                });
                t.start();
            }
            ready.await();
            startNanos = System.nanoTime();
        } catch (InterruptedException | RuntimeException | Error e) {
            aborted.set(true);
            log.warn("Race aborted after starting {} of {} callers: {}", started, callers, e.toString());
            throw e;
        } finally {
            // open the gate on every path so started callers never stay parked
            start.countDown();
        }
        done.await();
        long elapsed = System.nanoTime() - startNanos;

        // done.await() orders every results[] write before these reads
        Set<Object> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Object r : results) {
            if (r != null) {
                distinct.add(r);
            }
        }

        RaceReport report = new RaceReport(callers, distinct.size(), failures, elapsed);
        log.debug("Race finished: {}", report);
        return report;
    }
}
