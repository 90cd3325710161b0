package creational.demo.fixtures;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;

@Demo(order = 2)
public class AardvarkDemo implements PatternDemo {

    @Override
    public String name() {
        return "aardvark";
    }

    @Override
    public void run(DemoContext context) {
        context.out().println("ran aardvark");
    }
}
