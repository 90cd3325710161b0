package creational.singleton;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazy singleton using double-checked locking on a static {@code volatile} field.
 *
 * <p>The lock is taken only while the instance is still absent. The field must be
 * {@code volatile}; without it a reader on the fast path could observe a reference to a
 * partially constructed object.
 *
 * @see SingletonHolder
 */
public final class DoubleCheckedSingleton {

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(DoubleCheckedSingleton.class);
    private static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();
    private static final Object LOCK = new Object();

    private static volatile DoubleCheckedSingleton instance;

    private DoubleCheckedSingleton() {
        GUARD.checkConstruction();
        CONSTRUCTIONS.incrementAndGet();
    }

    /**
     * Returns the instance, creating it on first use.
     */
    public static DoubleCheckedSingleton getInstance() {
        DoubleCheckedSingleton result = instance;
        if (result != null) {
            return result;
        }
        synchronized (LOCK) {
            if (instance == null) {
                instance = GUARD.construct(DoubleCheckedSingleton::new);
            }
            return instance;
        }
    }

    /**
     * Returns how many times the constructor completed.
     */
    public static int constructionCount() {
        return CONSTRUCTIONS.get();
    }
}
