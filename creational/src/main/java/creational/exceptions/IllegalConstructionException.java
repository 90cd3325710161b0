package creational.exceptions;

/**
 * Exception thrown when a guarded type is constructed outside its accessor.
 *
 * <p>Types protected by a {@link creational.singleton.ConstructionGuard} may only be
 * instantiated through the guard, which is what {@code getInstance()} does. This exception
 * is raised when:
 * <ul>
 *   <li>the constructor is called directly, including through reflection</li>
 *   <li>a second instance is constructed after the first one succeeded</li>
 *   <li>construction of the type re-enters itself on the same thread</li>
 * </ul>
 *
 * <p>This is an unchecked exception because it signals a programming error in the caller,
 * not a condition the caller can recover from.
 *
 * @see creational.singleton.ConstructionGuard
 */
public class IllegalConstructionException extends RuntimeException {

    /**
     * Why a construction attempt was rejected.
     */
    public enum Reason {
        /** The constructor ran without a permit from the guard */
        OUTSIDE_ACCESSOR,
        /** An instance was already constructed through the guard */
        ALREADY_CONSTRUCTED,
        /** The guard was entered again while constructing on the same thread */
        RECURSIVE
    }

    private final Class<?> type;
    private final Reason reason;

    /**
     * Creates a new exception for the given type and reason.
     *
     * @param type the guarded type
     * @param reason why construction was rejected
     */
    public IllegalConstructionException(Class<?> type, Reason reason) {
        super(formatMessage(type, reason));
        this.type = type;
        this.reason = reason;
    }

    /**
     * Returns the guarded type whose construction was rejected.
     *
     * @return the guarded type
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Returns why construction was rejected.
     *
     * @return the rejection reason
     */
    public Reason getReason() {
        return reason;
    }

    private static String formatMessage(Class<?> type, Reason reason) {
        String name = type != null ? type.getName() : "unknown";
        switch (reason) {
            case OUTSIDE_ACCESSOR:
                return "Direct construction of " + name + " is not allowed, use getInstance()";
            case ALREADY_CONSTRUCTED:
                return name + " is a singleton and has already been constructed";
            case RECURSIVE:
                return "Recursive construction of " + name;
            default:
                return "Illegal construction of " + name;
        }
    }
}
