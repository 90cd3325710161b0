package creational.factory.payment;

public class UpiPayment extends AbstractPayment {

    @Override
    public PaymentMethod method() {
        return PaymentMethod.UPI;
    }
}
