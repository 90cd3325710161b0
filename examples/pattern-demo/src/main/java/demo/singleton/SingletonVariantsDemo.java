package demo.singleton;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.singleton.SingletonVariant;

/**
 * Calls every static singleton twice and checks both calls return the same object.
 */
@Demo(order = 40)
public class SingletonVariantsDemo implements PatternDemo {

    @Override
    public String name() {
        return "singleton/variants";
    }

    @Override
    public void run(DemoContext context) {
        for (SingletonVariant variant : SingletonVariant.values()) {
            Object first = variant.instance();
            Object second = variant.instance();
            if (first != second) {
                throw new IllegalStateException(variant + " returned two different instances");
            }
            context.out().printf("%-15s lazy=%-5s threadSafe=%-5s constructions=%d%n",
                    variant, variant.isLazy(), variant.isThreadSafe(), variant.constructionCount());
        }
    }
}
