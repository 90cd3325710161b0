package creational.factory.payment;

import java.util.Locale;

/**
 * Validates the amount and formats the receipt shared by every payment method.
 */
abstract class AbstractPayment implements Payment {

    @Override
    public final String process(double amount) {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        return String.format(Locale.ROOT, "Payment done through %s: %.2f", method().label(), amount);
    }
}
