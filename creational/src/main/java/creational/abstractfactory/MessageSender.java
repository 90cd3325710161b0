package creational.abstractfactory;

/**
 * Delivers an already formatted message.
 */
public interface MessageSender {

    /**
     * Sends the message.
     *
     * @param message the formatted message
     */
    void send(String message);
}
