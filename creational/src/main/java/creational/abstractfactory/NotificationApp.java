package creational.abstractfactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Client of the notification abstract factory.
 *
 * <p>The app asks its factory for one sender and one formatter at construction and uses
 * them for every notification. It never names a concrete channel class.
 *
 * <h2>Usage:</h2>
 * <pre>
 * NotificationApp app = new NotificationApp(NotificationFactories.forName("sms"));
 * app.notify("Your OTP is 123456");
 * </pre>
 */
public class NotificationApp {

    private static final Logger log = LoggerFactory.getLogger(NotificationApp.class);

    private final MessageSender sender;
    private final MessageFormatter formatter;

    public NotificationApp(NotificationFactory factory) {
        Objects.requireNonNull(factory, "factory");
        this.sender = Objects.requireNonNull(factory.createSender(), "sender");
        this.formatter = Objects.requireNonNull(factory.createFormatter(), "formatter");
    }

    /**
     * Formats the message and sends it.
     *
     * @param message the raw message
     * @return the formatted message that was sent
     */
    public String notify(String message) {
        Objects.requireNonNull(message, "message");
        String formatted = formatter.format(message);
        log.debug("Sending notification via {}", sender.getClass().getSimpleName());
        sender.send(formatted);
        return formatted;
    }
}
