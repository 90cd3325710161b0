package creational.singleton;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazy singleton whose accessor is {@code synchronized} as a whole.
 *
 * <p>Correct under any number of threads, but every call pays for the class monitor,
 * even long after the instance exists.
 */
public final class SynchronizedSingleton {

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(SynchronizedSingleton.class);
    private static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();

    private static SynchronizedSingleton instance;

    private SynchronizedSingleton() {
        GUARD.checkConstruction();
        CONSTRUCTIONS.incrementAndGet();
    }

    /**
     * Returns the instance, creating it on first use. Locks on every call.
     */
    public static synchronized SynchronizedSingleton getInstance() {
        if (instance == null) {
            instance = GUARD.construct(SynchronizedSingleton::new);
        }
        return instance;
    }

    /**
     * Returns how many times the constructor completed.
     */
    public static int constructionCount() {
        return CONSTRUCTIONS.get();
    }
}
