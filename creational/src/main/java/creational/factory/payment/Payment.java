package creational.factory.payment;

/**
 * Product created by a {@link PaymentFactory}.
 */
public interface Payment {

    /**
     * Processes a payment and returns the receipt line.
     *
     * @param amount the amount to charge, must be positive
     * @return the receipt, e.g. {@code "Payment done through UPI: 1500.00"}
     * @throws IllegalArgumentException if the amount is not positive or not finite
     */
    String process(double amount);

    /**
     * Returns the method this payment uses.
     */
    PaymentMethod method();
}
