package demo.abstractfactory;

import creational.abstractfactory.NotificationApp;
import creational.abstractfactory.NotificationChannel;
import creational.abstractfactory.NotificationFactories;
import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

/**
 * Abstract Factory: a sender and a formatter from the same family, never mixed.
 */
@Demo(order = 20)
public class NotificationDemo implements PatternDemo {

    @Override
    public String name() {
        return "abstract-factory/notifications";
    }

    @Override
    public void run(DemoContext context) {
        NotificationChannel configured = context.config().notificationChannel();
        new NotificationApp(NotificationFactories.forChannel(configured, context.out()))
                .notify("Welcome to " + context.config().serviceName());

        for (NotificationChannel channel : NotificationChannel.values()) {
            NotificationApp app = new NotificationApp(NotificationFactories.forChannel(channel, context.out()));
            app.notify("Hello Satya!");
        }
    }
}
