package creational.singleton;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Singleton created on the first call to {@link #getInstance()}.
 *
 * <p><b>Not thread-safe.</b> Two threads may both see {@code null} and both try to construct.
 * The construction guard rejects the second attempt with an
 * {@link creational.exceptions.IllegalConstructionException}, so a race fails loudly instead
 * of producing a second instance. Use {@link DoubleCheckedSingleton} or
 * {@link HolderSingleton} when more than one thread can call the accessor.
 */
public final class LazySingleton {

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(LazySingleton.class);
    private static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();

    private static LazySingleton instance;

    private LazySingleton() {
        GUARD.checkConstruction();
        CONSTRUCTIONS.incrementAndGet();
    }

    /**
     * Returns the instance, creating it on first use.
     */
    public static LazySingleton getInstance() {
        if (instance == null) {
            instance = GUARD.construct(LazySingleton::new);
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
