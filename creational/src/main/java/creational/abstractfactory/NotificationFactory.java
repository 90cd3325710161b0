package creational.abstractfactory;

/**
 * Abstract factory for a family of related notification objects.
 *
 * <p>A factory always returns a sender and a formatter from the same channel, so an
 * email formatter is never paired with an SMS sender.
 *
 * @see NotificationApp
 * @see NotificationFactories
 */
public interface NotificationFactory {

    /**
     * Creates the sender of this family.
     */
    MessageSender createSender();

    /**
     * Creates the formatter of this family.
     */
    MessageFormatter createFormatter();

    /**
     * Returns the channel this family belongs to.
     */
    NotificationChannel channel();
}
