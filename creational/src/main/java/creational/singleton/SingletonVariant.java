package creational.singleton;

import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * The static singleton implementations, so they can be exercised side by side.
 */
public enum SingletonVariant {

    EAGER(EagerSingleton::getInstance, EagerSingleton::constructionCount, false, true),
    LAZY(LazySingleton::getInstance, LazySingleton::constructionCount, true, false),
    SYNCHRONIZED(SynchronizedSingleton::getInstance, SynchronizedSingleton::constructionCount, true, true),
    DOUBLE_CHECKED(DoubleCheckedSingleton::getInstance, DoubleCheckedSingleton::constructionCount, true, true),
    HOLDER(HolderSingleton::getInstance, HolderSingleton::constructionCount, true, true);

    private final Supplier<Object> accessor;
    private final IntSupplier constructions;
    private final boolean lazy;
    private final boolean threadSafe;

    SingletonVariant(Supplier<Object> accessor, IntSupplier constructions, boolean lazy, boolean threadSafe) {
        this.accessor = accessor;
        this.constructions = constructions;
        this.lazy = lazy;
        this.threadSafe = threadSafe;
    }

    /** Calls the variant's {@code getInstance()}. */
    public Object instance() {
        return accessor.get();
    }

    /** Returns how many instances of the variant have been constructed. */
    public int constructionCount() {
        return constructions.getAsInt();
    }

    /** Returns true if the instance is created on first access rather than at class load. */
    public boolean isLazy() {
        return lazy;
    }

    /** Returns true if concurrent first calls are guaranteed to see a single instance. */
    public boolean isThreadSafe() {
        return threadSafe;
    }
}
