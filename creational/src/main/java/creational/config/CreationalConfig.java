package creational.config;

import creational.abstractfactory.NotificationChannel;
import creational.factory.payment.PaymentMethod;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by the pattern demos and the {@link creational.singleton.ConfigurationManager}.
 *
 * <p>Configuration can be loaded from {@code creational.properties} or
 * {@code creational.yml} using {@link CreationalConfigLoader}.
 *
 * @see CreationalConfigLoader
 */
public final class CreationalConfig {

    public static final CreationalConfig DEFAULTS = builder().build();

    private final String serviceName;
    private final NotificationChannel notificationChannel;
    private final PaymentMethod paymentMethod;
    private final int raceCallers;
    private final Duration demoTimeout;

    private CreationalConfig(Builder b) {
        this.serviceName = b.serviceName;
        this.notificationChannel = b.notificationChannel;
        this.paymentMethod = b.paymentMethod;
        this.raceCallers = b.raceCallers;
        this.demoTimeout = b.demoTimeout;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the name of the service this configuration belongs to. */
    public String serviceName() { return serviceName; }

    /** Returns the channel used when a notification factory is picked from config. */
    public NotificationChannel notificationChannel() { return notificationChannel; }

    /** Returns the payment method used when a payment factory is picked from config. */
    public PaymentMethod paymentMethod() { return paymentMethod; }

    /** Returns how many concurrent callers a singleton race uses. */
    public int raceCallers() { return raceCallers; }

    /** Returns the per-demo timeout, or {@link Duration#ZERO} for none. */
    public Duration demoTimeout() { return demoTimeout; }

    @Override
    public String toString() {
        return "CreationalConfig{" +
                "serviceName=" + serviceName +
                ", notificationChannel=" + notificationChannel +
                ", paymentMethod=" + paymentMethod +
                ", raceCallers=" + raceCallers +
                ", demoTimeout=" + demoTimeout.toSeconds() + "s" +
                '}';
    }

    /**
     * Builder for constructing {@link CreationalConfig} instances.
     */
    public static final class Builder {
        private String serviceName = "creational";
        private NotificationChannel notificationChannel = NotificationChannel.EMAIL;
        private PaymentMethod paymentMethod = PaymentMethod.CARD;
        private int raceCallers = 100;
        private Duration demoTimeout = Duration.ZERO;

        public Builder serviceName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("serviceName must not be blank");
            }
            this.serviceName = name;
            return this;
        }

        public Builder notificationChannel(NotificationChannel channel) {
            this.notificationChannel = Objects.requireNonNull(channel, "channel");
            return this;
        }

        public Builder paymentMethod(PaymentMethod method) {
            this.paymentMethod = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder raceCallers(int callers) {
            if (callers <= 0) throw new IllegalArgumentException("raceCallers must be positive");
            this.raceCallers = callers;
            return this;
        }

        public Builder demoTimeout(Duration timeout) {
            this.demoTimeout = timeout != null ? timeout : Duration.ZERO;
            return this;
        }

        public Builder demoTimeoutSeconds(long seconds) {
            return demoTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public CreationalConfig build() {
            return new CreationalConfig(this);
        }
    }
}
