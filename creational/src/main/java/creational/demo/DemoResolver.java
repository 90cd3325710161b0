package creational.demo;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Instantiates {@link PatternDemo}s from classes found by {@link DemoScanner}.
 *
 * <p>Each class must implement {@link PatternDemo} and declare a no-arg constructor,
 * which may be private.
 */
public final class DemoResolver {

    /**
     * Instantiates a single demo class.
     *
     * @param type the class annotated with {@code @Demo}
     * @return a new demo instance
     * @throws IllegalStateException if the class does not implement PatternDemo or has no no-arg constructor
     * @throws RuntimeException if the constructor throws
     */
    public PatternDemo resolve(Class<?> type) {
        if (!PatternDemo.class.isAssignableFrom(type)) {
            throw new IllegalStateException(
                    "@Demo must implement PatternDemo: " + type.getName()
            );
        }

        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return (PatternDemo) ctor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(
                    type.getName() + " must have a no-arg constructor", e
            );
        } catch (Exception e) {
            throw new RuntimeException(
                    "Failed to instantiate " + type.getName(), e
            );
        }
    }

    /**
     * Instantiates every class, keeping their order.
     *
     * @param types classes annotated with {@code @Demo}
     * @return the demo instances
     * @throws IllegalStateException if any class is invalid
     */
    public List<PatternDemo> resolveAll(Collection<Class<?>> types) {
        List<PatternDemo> demos = new ArrayList<>(types.size());
        for (Class<?> type : types) {
            demos.add(resolve(type));
        }
        return demos;
    }
}
