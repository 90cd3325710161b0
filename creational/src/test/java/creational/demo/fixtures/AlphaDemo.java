package creational.demo.fixtures;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

@Demo(order = 1)
public class AlphaDemo implements PatternDemo {

    @Override
    public String name() {
        return "alpha";
    }

    @Override
    public void run(DemoContext context) {
        context.out().println("ran alpha");
    }
}
