package creational.factory.payment;

public class NetBankingPayment extends AbstractPayment {

    @Override
    public PaymentMethod method() {
        return PaymentMethod.NET;
    }
}
