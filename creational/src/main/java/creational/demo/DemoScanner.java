package creational.demo;

import creational.exceptions.DemoNotFoundException;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scans the classpath for classes annotated with {@link Demo}.
 *
 * <p>Only the given package and its subpackages are searched. Results are ordered by
 * {@link Demo#order()} and then by fully qualified class name, so runs are repeatable.
 *
 * <h2>Usage:</h2>
 * <pre>
 * List&lt;Class&lt;?&gt;&gt; demos = DemoScanner.scan("demo");
 * </pre>
 *
 * @see DemoResolver
 */
public final class DemoScanner {

    private static final Logger log = LoggerFactory.getLogger(DemoScanner.class);

    private static final Comparator<Class<?>> RUN_ORDER =
            Comparator.<Class<?>>comparingInt(type -> type.getAnnotation(Demo.class).order())
                    .thenComparing(Class::getName);

    private DemoScanner() {
    }

    /**
     * Scans a package for demo classes.
     *
     * @param packagePrefix the package to search, e.g. {@code "demo"}
     * @return the annotated classes in run order, never empty
     * @throws DemoNotFoundException if no annotated class is found
     * @throws IllegalArgumentException if the prefix is null or blank
     */
    public static List<Class<?>> scan(String packagePrefix) {
        if (packagePrefix == null || packagePrefix.isBlank()) {
            throw new IllegalArgumentException("packagePrefix must be provided");
        }

        Collection<URL> urls = ClasspathHelper.forPackage(packagePrefix);
        if (urls.isEmpty()) {
            throw new DemoNotFoundException("No @Demo found: package '" + packagePrefix + "' is not on the classpath");
        }

        ConfigurationBuilder config = new ConfigurationBuilder()
                .setUrls(urls)
                .addScanners(Scanners.TypesAnnotated);

        Reflections reflections = new Reflections(config);

        String packagePath = packagePrefix + ".";
        List<Class<?>> demos = reflections.getTypesAnnotatedWith(Demo.class).stream()
                .filter(type -> type.getName().startsWith(packagePath))
                .filter(type -> type.isAnnotationPresent(Demo.class))
                .sorted(RUN_ORDER)
                .collect(Collectors.toList());

        if (demos.isEmpty()) {
            throw new DemoNotFoundException("No @Demo found in package '" + packagePrefix + "'");
        }

        log.debug("Found {} demo(s) in '{}'", demos.size(), packagePrefix);
        return demos;
    }
}
