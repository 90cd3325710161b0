package creational.factory.payment;

public class CreditCardPayment extends AbstractPayment {

    @Override
    public PaymentMethod method() {
        return PaymentMethod.CARD;
    }
}
