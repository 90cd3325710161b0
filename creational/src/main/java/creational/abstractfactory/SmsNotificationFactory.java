package creational.abstractfactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Creates the SMS family: {@link SmsMessageSender} and {@link SmsMessageFormatter}.
 */
public class SmsNotificationFactory implements NotificationFactory {

    private final PrintStream out;

    public SmsNotificationFactory() {
        this(System.out);
    }

    /**
     * @param out where created senders write their messages
     */
    public SmsNotificationFactory(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public MessageSender createSender() {
        return new SmsMessageSender(out);
    }

    @Override
    public MessageFormatter createFormatter() {
        return new SmsMessageFormatter();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }
}
