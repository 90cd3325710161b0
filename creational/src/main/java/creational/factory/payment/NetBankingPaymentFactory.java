package creational.factory.payment;

public class NetBankingPaymentFactory implements PaymentFactory {

    @Override
    public Payment createPayment() {
        return new NetBankingPayment();
    }
}
