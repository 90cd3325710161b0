package creational.singleton;

import creational.exceptions.IllegalConstructionException;
import creational.exceptions.IllegalConstructionException.Reason;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Restricts construction of a type to a single, permitted path.
 *
 * <p>The guarded type calls {@link #checkConstruction()} as the first statement of its
 * private constructor. The call succeeds only while the current thread is inside
 * {@link #construct(Supplier)} (or the holder's equivalent), and only once per guard.
 * Every other path, including reflection, fails with {@link IllegalConstructionException}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * public final class Registry {
 *     private static final ConstructionGuard GUARD = ConstructionGuard.forType(Registry.class);
 *     private static final Registry INSTANCE = GUARD.construct(Registry::new);
 *
 *     private Registry() {
 *         GUARD.checkConstruction();
 *     }
 * }
 * </pre>
 *
 * <p>If the constructor fails after the check, the claim is released so a later attempt
 * can construct the instance.
 *
 * @see SingletonHolder
 */
public final class ConstructionGuard {

    private final Class<?> type;
    private final AtomicBoolean constructed = new AtomicBoolean(false);
    private final ThreadLocal<Permit> permit = new ThreadLocal<>();

    private static final class Permit {
        boolean claimed;
    }

    private ConstructionGuard(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a guard for the given type.
     *
     * @param type the type whose constructor will call {@link #checkConstruction()}
     * @return a new guard
     */
    public static ConstructionGuard forType(Class<?> type) {
        return new ConstructionGuard(type);
    }

    /**
     * Returns the guarded type.
     */
    public Class<?> type() {
        return type;
    }

    /**
     * Returns true once an instance has been constructed through this guard.
     */
    public boolean isConstructed() {
        return constructed.get();
    }

    /**
     * Called from the guarded constructor. Claims the single construction slot.
     *
     * @throws IllegalConstructionException if no permit is held by this thread
     *         ({@link Reason#OUTSIDE_ACCESSOR}) or an instance already exists
     *         ({@link Reason#ALREADY_CONSTRUCTED})
     */
    public void checkConstruction() {
        Permit p = permit.get();
        if (p == null) {
            throw new IllegalConstructionException(type, Reason.OUTSIDE_ACCESSOR);
        }
        if (p.claimed || !constructed.compareAndSet(false, true)) {
            throw new IllegalConstructionException(type, Reason.ALREADY_CONSTRUCTED);
        }
        p.claimed = true;
    }

    /**
     * Runs the constructor reference with a permit. For static initializers, where checked
     * exceptions cannot be thrown.
     *
     * @param constructor typically a constructor reference of the guarded type
     * @param <T> the guarded type
     * @return the constructed instance
     * @throws IllegalConstructionException if construction is rejected
     */
    public <T> T construct(Supplier<T> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        try {
            return constructChecked(constructor::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // Supplier cannot throw checked exceptions
            throw new IllegalStateException(e);
        }
    }

    /**
     * Runs the factory with a permit, propagating checked exceptions.
     */
    <T> T constructChecked(InstanceFactory<T> factory) throws Exception {
        if (permit.get() != null) {
            throw new IllegalConstructionException(type, Reason.RECURSIVE);
        }
        Permit p = new Permit();
        permit.set(p);
        boolean success = false;
        try {
            T instance = factory.create();
            success = true;
            if (!p.claimed) {
                // constructor did not call checkConstruction(), still count it
                constructed.set(true);
            }
            return instance;
        } finally {
            permit.remove();
            if (!success && p.claimed) {
                constructed.set(false);
            }
        }
    }
}
