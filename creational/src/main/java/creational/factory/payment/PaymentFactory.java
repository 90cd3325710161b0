package creational.factory.payment;

/**
 * Creator declaring the factory method for {@link Payment}s.
 *
 * @see PaymentFactories
 */
public interface PaymentFactory {

    /**
     * Creates a new payment.
     *
     * @return a new payment, never null
     */
    Payment createPayment();
}
