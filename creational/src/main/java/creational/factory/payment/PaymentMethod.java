package creational.factory.payment;

/**
 * Supported payment methods.
 *
 * <p>Each method has a short alias ({@code Card}, {@code UPI}, {@code Net}) accepted by
 * {@link PaymentFactories#forName(String)} and a label used on receipts.
 */
public enum PaymentMethod {
    CARD("Card", "Credit Card"),
    UPI("UPI", "UPI"),
    NET("Net", "Net Banking");

    private final String alias;
    private final String label;

    PaymentMethod(String alias, String label) {
        this.alias = alias;
        this.label = label;
    }

    /** Returns the short name accepted by {@link PaymentFactories#forName(String)}. */
    public String alias() {
        return alias;
    }

    /** Returns the human-readable label printed on receipts. */
    public String label() {
        return label;
    }
}
