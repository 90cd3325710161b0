package demo.builder;

import creational.builder.Order;
import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

import java.time.LocalDateTime;

/**
 * Builder with required and optional parts: only the id and restaurant are mandatory.
 */
@Demo(order = 31)
public class OrderBuilderDemo implements PatternDemo {

    @Override
    public String name() {
        return "builder/order";
    }

    @Override
    public void run(DemoContext context) {
        Order quick = Order.builder("123", "Datchu").build();

        Order full = Order.builder("124", "Datchu")
                .deliveryAddress("Chennai")
                .couponCode("001")
                .instructions("Ring the bell twice")
                .contactless(true)
                .scheduledTime(LocalDateTime.now().plusHours(2).withNano(0))
                .build();

        context.out().println(quick);
        context.out().println(full);
    }
}
