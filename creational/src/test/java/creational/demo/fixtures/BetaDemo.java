package creational.demo.fixtures;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

@Demo(order = 2)
public class BetaDemo implements PatternDemo {

    @Override
    public String name() {
        return "beta";
    }

    @Override
    public void run(DemoContext context) {
        context.out().println("ran beta");
    }
}
