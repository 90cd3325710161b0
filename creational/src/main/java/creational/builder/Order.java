package creational.builder;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable food delivery order.
 *
 * <p>The order id and restaurant name are required and passed to {@link #builder(String, String)};
 * everything else is optional and set through the {@link Builder}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * Order order = Order.builder("123", "Datchu")
 *     .deliveryAddress("Chennai")
 *     .couponCode("001")
 *     .contactless(true)
 *     .build();
 * </pre>
 */
public final class Order {

    private final String orderId;
    private final String restaurantName;
    private final String deliveryAddress;
    private final String couponCode;
    private final String instructions;
    private final boolean contactless;
    private final LocalDateTime scheduledTime;

    private Order(Builder b) {
        this.orderId = b.orderId;
        this.restaurantName = b.restaurantName;
        this.deliveryAddress = b.deliveryAddress;
        this.couponCode = b.couponCode;
        this.instructions = b.instructions;
        this.contactless = b.contactless;
        this.scheduledTime = b.scheduledTime;
    }

    /**
     * Creates a new order builder.
     *
     * @param orderId the order id, required
     * @param restaurantName the restaurant name, required
     * @return a new builder instance
     * @throws IllegalArgumentException if either value is null or blank
     */
    public static Builder builder(String orderId, String restaurantName) {
        return new Builder(orderId, restaurantName);
    }

    public String orderId() { return orderId; }

    public String restaurantName() { return restaurantName; }

    public Optional<String> deliveryAddress() { return Optional.ofNullable(deliveryAddress); }

    public Optional<String> couponCode() { return Optional.ofNullable(couponCode); }

    public Optional<String> instructions() { return Optional.ofNullable(instructions); }

    /** Returns true if the order should be delivered without contact. */
    public boolean isContactless() { return contactless; }

    /** Returns when the order is scheduled, or empty for as soon as possible. */
    public Optional<LocalDateTime> scheduledTime() { return Optional.ofNullable(scheduledTime); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order)) return false;
        Order other = (Order) o;
        return contactless == other.contactless
                && orderId.equals(other.orderId)
                && restaurantName.equals(other.restaurantName)
                && Objects.equals(deliveryAddress, other.deliveryAddress)
                && Objects.equals(couponCode, other.couponCode)
                && Objects.equals(instructions, other.instructions)
                && Objects.equals(scheduledTime, other.scheduledTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, restaurantName, deliveryAddress, couponCode,
                instructions, contactless, scheduledTime);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Order{")
                .append("orderId=").append(orderId)
                .append(", restaurant=").append(restaurantName);
        if (deliveryAddress != null) sb.append(", deliveryAddress=").append(deliveryAddress);
        if (couponCode != null) sb.append(", coupon=").append(couponCode);
        if (instructions != null) sb.append(", instructions=").append(instructions);
        if (contactless) sb.append(", contactless");
        if (scheduledTime != null) sb.append(", scheduledTime=").append(scheduledTime);
        return sb.append('}').toString();
    }

    /**
     * Builder for constructing {@link Order} instances.
     */
    public static final class Builder {
        private final String orderId;
        private final String restaurantName;
        private String deliveryAddress;
        private String couponCode;
        private String instructions;
        private boolean contactless;
        private LocalDateTime scheduledTime;

        private Builder(String orderId, String restaurantName) {
            this.orderId = required(orderId, "orderId");
            this.restaurantName = required(restaurantName, "restaurantName");
        }

        private static String required(String value, String field) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(field + " must be provided");
            }
            return value;
        }

        public Builder deliveryAddress(String address) {
            this.deliveryAddress = address;
            return this;
        }

        public Builder couponCode(String coupon) {
            this.couponCode = coupon;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder contactless(boolean contactless) {
            this.contactless = contactless;
            return this;
        }

        public Builder scheduledTime(LocalDateTime time) {
            this.scheduledTime = time;
            return this;
        }

        public Order build() {
            return new Order(this);
        }
    }
}
