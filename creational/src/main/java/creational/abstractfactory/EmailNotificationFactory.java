package creational.abstractfactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Creates the EMAIL family: {@link EmailMessageSender} and {@link EmailMessageFormatter}.
 */
public class EmailNotificationFactory implements NotificationFactory {

    private final PrintStream out;

    public EmailNotificationFactory() {
        this(System.out);
    }

    /**
     * @param out where created senders write their messages
     */
    public EmailNotificationFactory(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public MessageSender createSender() {
        return new EmailMessageSender(out);
    }

    @Override
    public MessageFormatter createFormatter() {
        return new EmailMessageFormatter();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }
}
