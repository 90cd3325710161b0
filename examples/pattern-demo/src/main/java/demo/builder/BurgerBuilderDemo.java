package demo.builder;

import creational.builder.Burger;
import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

@Demo(order = 30)
public class BurgerBuilderDemo implements PatternDemo {

    @Override
    public String name() {
        return "builder/burger";
    }

    @Override
    public void run(DemoContext context) {
        Burger classic = Burger.builder("Medium")
                .addCheese()
                .addLettuce()
                .addTomato()
                .build();

        Burger loaded = Burger.builder("Large")
                .addCheese()
                .addPepperoni()
                .addExtraPatty()
                .build();

        Burger plain = Burger.builder("Small").build();

        context.out().println(classic);
        context.out().println(loaded);
        context.out().println(plain);
    }
}
