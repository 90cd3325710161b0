package creational.abstractfactory;

/**
 * Notification families supported by {@link NotificationFactories}.
 */
public enum NotificationChannel {
    EMAIL,
    SMS
}
