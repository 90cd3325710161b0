package creational.singleton;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Singleton created when the class is initialized, whether or not it is ever used.
 *
 * <p>Class initialization is serialized by the JVM, so no locking is needed. The cost is
 * that the instance exists from the first time anything touches the class.
 */
public final class EagerSingleton {

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(EagerSingleton.class);
    private static final AtomicInteger CONSTRUCTIONS = new AtomicInteger();

    private static final EagerSingleton INSTANCE = GUARD.construct(EagerSingleton::new);

    private EagerSingleton() {
        GUARD.checkConstruction();
        CONSTRUCTIONS.incrementAndGet();
    }

    /**
     * Returns the instance created at class initialization.
     */
    public static EagerSingleton getInstance() {
        return INSTANCE;
    }

    /**
     * Returns how many times the constructor completed. Always one.
     */
    public static int constructionCount() {
        return CONSTRUCTIONS.get();
    }
}
