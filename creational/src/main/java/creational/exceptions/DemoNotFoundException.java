package creational.exceptions;

/**
 * Exception thrown when scanning finds no class annotated with {@link creational.demo.Demo}.
 *
 * <p>This usually means the package prefix is wrong or the demo classes are not on the
 * classpath.
 *
 * @see creational.demo.DemoScanner
 */
public class DemoNotFoundException extends RuntimeException {

    /**
     * Creates a new exception with the specified message.
     *
     * @param message description of what was scanned
     */
    public DemoNotFoundException(String message) {
        super(message);
    }
}
