package creational.demo;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link PatternDemo} implementation for discovery by {@link DemoScanner}.
 *
 * <p>The annotated class must implement {@link PatternDemo} and have a no-arg constructor.
 * Demos run in ascending {@link #order()}, ties broken by class name.
 *
 * <h2>Example:</h2>
 * <pre>
 * &#64;Demo(order = 10)
 * public class VehicleFactoryDemo implements PatternDemo {
 *     ...
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Demo {

    /** Position of the demo in a run. Lower runs first. */
    int order() default 0;
}
