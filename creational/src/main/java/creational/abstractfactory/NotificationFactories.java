package creational.abstractfactory;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Selects a {@link NotificationFactory} at runtime.
 */
public final class NotificationFactories {

    private NotificationFactories() {}

    /**
     * Returns the factory for a channel, writing to standard output.
     */
    public static NotificationFactory forChannel(NotificationChannel channel) {
        return forChannel(channel, System.out);
    }

    /**
     * Returns the factory for a channel whose senders write to {@code out}.
     *
     * @param channel the notification channel
     * @param out where senders write
     * @return a new factory
     */
    public static NotificationFactory forChannel(NotificationChannel channel, PrintStream out) {
        Objects.requireNonNull(channel, "channel");
        switch (channel) {
            case EMAIL:
                return new EmailNotificationFactory(out);
            case SMS:
                return new SmsNotificationFactory(out);
            default:
                throw new IllegalArgumentException("Unsupported notification type: " + channel);
        }
    }

    /**
     * Returns the factory for a channel name ({@code "email"} or {@code "sms"}, any case),
     * writing to standard output.
     *
     * @throws IllegalArgumentException if the name is not a supported channel
     */
    public static NotificationFactory forName(String name) {
        return forName(name, System.out);
    }

    /**
     * Returns the factory for a channel name whose senders write to {@code out}.
     *
     * @throws IllegalArgumentException if the name is not a supported channel
     */
    public static NotificationFactory forName(String name, PrintStream out) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (NotificationChannel channel : NotificationChannel.values()) {
                if (channel.name().equals(key)) {
                    return forChannel(channel, out);
                }
            }
        }
        throw new IllegalArgumentException("Unsupported notification type: " + name);
    }
}
