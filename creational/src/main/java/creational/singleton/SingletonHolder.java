package creational.singleton;

import creational.exceptions.IllegalConstructionException;
import creational.exceptions.InitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily constructs exactly one instance and hands the same instance to every caller.
 *
 * <p>The holder is an ordinary object, so the construct-once contract can be owned,
 * injected and tested like any other dependency. A static singleton wraps it in a
 * {@code private static final} field.
 *
 * <p>{@link #get()} uses double-checked locking:
 * <ol>
 *   <li>read the {@code volatile} instance without locking and return it if present</li>
 *   <li>otherwise acquire the init lock</li>
 *   <li>read the instance again under the lock</li>
 *   <li>if still absent, run the factory and publish the result</li>
 *   <li>release the lock and return the instance</li>
 * </ol>
 *
 * <p>After the first successful call every read takes the lock-free path. A failed
 * construction releases the lock, leaves the holder {@link HolderState#UNINITIALIZED} and
 * surfaces an {@link InitializationException} to the caller that triggered it; the next
 * call tries again.
 *
 * <h2>Usage:</h2>
 * <pre>
 * SingletonHolder&lt;Connection&gt; connection =
 *     SingletonHolder.of("connection", () -&gt; openConnection());
 *
 * Connection c = connection.get();
 * </pre>
 *
 * @param <T> the type of the held instance
 * @see ConstructionGuard
 */
public final class SingletonHolder<T> {

    private static final Logger log = LoggerFactory.getLogger(SingletonHolder.class);

    private final String name;
    private final InstanceFactory<? extends T> factory;
    private final ConstructionGuard guard;

    private final ReentrantLock initLock = new ReentrantLock();
    private volatile T instance;

    private final AtomicInteger constructionCount = new AtomicInteger();
    private final AtomicInteger failedAttempts = new AtomicInteger();

    private SingletonHolder(String name, InstanceFactory<? extends T> factory, ConstructionGuard guard) {
        this.name = Objects.requireNonNull(name, "name");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.guard = guard;
    }

    /**
     * Creates a holder for a type that does not protect its own constructor.
     *
     * @param name name used in logs and exceptions
     * @param factory creates the instance on first access
     * @param <T> the held type
     * @return a new, uninitialized holder
     */
    public static <T> SingletonHolder<T> of(String name, InstanceFactory<? extends T> factory) {
        return new SingletonHolder<>(name, factory, null);
    }

    /**
     * Creates a holder whose factory runs with a permit from {@code guard}, so the
     * guarded constructor accepts it while every other construction path is rejected.
     *
     * @param guard the guard checked by the held type's constructor
     * @param factory creates the instance on first access
     * @param <T> the held type
     * @return a new, uninitialized holder named after the guarded type
     */
    public static <T> SingletonHolder<T> guarded(ConstructionGuard guard, InstanceFactory<? extends T> factory) {
        Objects.requireNonNull(guard, "guard");
        return new SingletonHolder<>(guard.type().getSimpleName(), factory, guard);
    }

    /**
     * Returns the held instance, constructing it if this is the first successful call.
     *
     * @return the single instance, identical for every caller
     * @throws InitializationException if the factory fails or returns null
     * @throws IllegalConstructionException if the guarded type rejects construction
     */
    public T get() {
        T result = instance;
        if (result != null) {
            return result;
        }
        if (initLock.isHeldByCurrentThread()) {
            throw new InitializationException(name, "recursive call to get() during construction");
        }

        initLock.lock();
        try {
            result = instance;
            if (result == null) {
                result = construct();
                instance = result;
            }
            return result;
        } finally {
            initLock.unlock();
        }
    }

    private T construct() {
        log.debug("Constructing singleton '{}'", name);
        T created;
        try {
            created = guard != null ? guard.constructChecked(this::createNonNull) : createNonNull();
        } catch (InitializationException | IllegalConstructionException e) {
            failedAttempts.incrementAndGet();
            log.warn("Construction of '{}' failed: {}", name, e.getMessage());
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failedAttempts.incrementAndGet();
            log.warn("Construction of '{}' failed: {}", name, e.toString());
            throw new InitializationException(name, String.valueOf(e.getMessage()), e);
        }
        int count = constructionCount.incrementAndGet();
        log.debug("Constructed singleton '{}' (construction #{})", name, count);
        return created;
    }

    private T createNonNull() throws Exception {
        T created = factory.create();
        if (created == null) {
            throw new InitializationException(name, "factory returned null");
        }
        return created;
    }

    /**
     * Returns the instance if it has been constructed, without triggering construction.
     *
     * @return the instance, or null while uninitialized
     */
    public T peek() {
        return instance;
    }

    /**
     * Returns the current lifecycle state.
     */
    public HolderState state() {
        return instance != null ? HolderState.INITIALIZED : HolderState.UNINITIALIZED;
    }

    /**
     * Returns true once the instance has been published.
     */
    public boolean isInitialized() {
        return instance != null;
    }

    /**
     * Returns the number of successful constructions. Never exceeds one.
     */
    public int constructionCount() {
        return constructionCount.get();
    }

    /**
     * Returns the number of construction attempts that failed.
     */
    public int failedAttempts() {
        return failedAttempts.get();
    }

    /**
     * Returns the holder name used in logs and exceptions.
     */
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "SingletonHolder{" +
                "name=" + name +
                ", state=" + state() +
                ", constructions=" + constructionCount.get() +
                ", failedAttempts=" + failedAttempts.get() +
                '}';
    }
}
