package creational.singleton;

/**
 * Creates the instance published by a {@link SingletonHolder}.
 *
 * <p>Unlike {@link java.util.function.Supplier}, the factory may throw checked exceptions.
 * The holder wraps any failure in an {@link creational.exceptions.InitializationException}.
 *
 * @param <T> the type of instance created
 */
@FunctionalInterface
public interface InstanceFactory<T> {

    /**
     * Creates a new instance.
     *
     * @return the new instance, never null
     * @throws Exception if construction fails
     */
    T create() throws Exception;
}
