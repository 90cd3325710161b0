package demo.factory;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.factory.payment.Payment;
import creational.factory.payment.PaymentFactories;
import creational.factory.payment.PaymentMethod;

/**
 * Factory Method chosen at runtime: the configured method goes first, then every alias
 * a customer could type at checkout.
 */
@Demo(order = 12)
public class PaymentFactoryDemo implements PatternDemo {

    private static final double AMOUNT = 1000;

    @Override
    public String name() {
        return "factory-method/payments";
    }

    @Override
    public void run(DemoContext context) {
        PaymentMethod configured = context.config().paymentMethod();
        Payment payment = PaymentFactories.forMethod(configured).createPayment();
        context.out().println(payment.process(AMOUNT));

        for (PaymentMethod method : PaymentMethod.values()) {
            Payment byAlias = PaymentFactories.forName(method.alias()).createPayment();
            context.out().println(byAlias.process(AMOUNT));
        }
    }
}
