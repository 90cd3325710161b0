package creational.singleton;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazy singleton using the initialization-on-demand holder idiom.
 *
 * <p>The nested {@code Holder} class is not initialized until {@link #getInstance()} first
 * reads its field, and the JVM initializes a class exactly once under its own lock. The
 * result is lazy and thread-safe with no explicit synchronization.
 *
 * <p>A constructor failure here surfaces as {@link ExceptionInInitializerError} and leaves
 * the holder class unusable; use {@link SingletonHolder} when construction may fail and
 * must be retried.
 */
public final class HolderSingleton {

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(HolderSingleton.class);
    private static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();

    private HolderSingleton() {
        GUARD.checkConstruction();
        CONSTRUCTIONS.incrementAndGet();
    }

    private static final class Holder {
        static final HolderSingleton INSTANCE = GUARD.construct(HolderSingleton::new);
    }

    /**
     * Returns the instance, initializing the holder class on first use.
     */
    public static HolderSingleton getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Returns how many times the constructor completed.
     */
    public static int constructionCount() {
        return CONSTRUCTIONS.get();
    }
}
