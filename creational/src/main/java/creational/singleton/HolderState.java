package creational.singleton;

/**
 * Lifecycle of a {@link SingletonHolder}. The only transition is
 * {@code UNINITIALIZED -> INITIALIZED} and it happens at most once.
 */
public enum HolderState {
    /** No instance has been published yet (or every attempt so far failed) */
    UNINITIALIZED,
    /** The instance is published and will never change */
    INITIALIZED
}
