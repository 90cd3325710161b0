package creational.abstractfactory;

/**
 * Formats a message for one notification channel.
 */
public interface MessageFormatter {

    /**
     * Formats the message.
     *
     * @param message the raw message
     * @return the formatted message
     */
    String format(String message);
}
