package creational.factory.payment;

import java.util.Objects;

/**
 * Picks a {@link PaymentFactory} at runtime, so clients never instantiate a concrete payment.
 *
 * <h2>Usage:</h2>
 * <pre>
 * PaymentFactory factory = PaymentFactories.forName("UPI");
 * String receipt = factory.createPayment().process(1500);
 * </pre>
 */
public final class PaymentFactories {

    private PaymentFactories() {}

    /**
     * Returns the factory for a payment method.
     *
     * @param method the payment method
     * @return a new factory for that method
     */
    public static PaymentFactory forMethod(PaymentMethod method) {
        Objects.requireNonNull(method, "method");
        switch (method) {
            case CARD:
                return new CreditCardPaymentFactory();
            case UPI:
                return new UpiPaymentFactory();
            case NET:
                return new NetBankingPaymentFactory();
            default:
                throw new IllegalArgumentException("Unsupported payment method: " + method);
        }
    }

    /**
     * Returns the factory for a payment method name.
     *
     * <p>Accepts the aliases {@code Card}, {@code UPI} and {@code Net} as well as the enum
     * names, ignoring case.
     *
     * @param name the payment method name
     * @return a new factory for that method
     * @throws IllegalArgumentException if the name is not a supported method
     */
    public static PaymentFactory forName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (PaymentMethod method : PaymentMethod.values()) {
                if (method.alias().equalsIgnoreCase(trimmed) || method.name().equalsIgnoreCase(trimmed)) {
                    return forMethod(method);
                }
            }
        }
        throw new IllegalArgumentException("Unsupported payment type: " + name);
    }
}
