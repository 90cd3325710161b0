package demo.singleton;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.exceptions.IllegalConstructionException;
import creational.singleton.ConfigurationManager;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * The configuration manager is built once on first use, and reflection cannot make a second one.
 */
@Demo(order = 42)
public class ConfigurationManagerDemo implements PatternDemo {

    @Override
    public String name() {
        return "singleton/configuration-manager";
    }

    @Override
    public void run(DemoContext context) throws ReflectiveOperationException {
        ConfigurationManager manager = ConfigurationManager.getInstance();
        if (manager != ConfigurationManager.getInstance()) {
            throw new IllegalStateException("ConfigurationManager returned two different instances");
        }
        context.out().println("Loaded " + manager.config() + " at " + manager.loadedAt());

        Constructor<?>[] constructors = ConfigurationManager.class.getDeclaredConstructors();
        Constructor<?> ctor = constructors[0];
        ctor.setAccessible(true);
        try {
            ctor.newInstance(manager.config());
            throw new IllegalStateException("Reflective construction was not rejected");
        } catch (InvocationTargetException e) {
            if (!(e.getCause() instanceof IllegalConstructionException)) {
                throw e;
            }
            context.out().println("Reflection rejected: " + e.getCause().getMessage());
        }
    }
}
