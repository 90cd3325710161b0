package demo.factory;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.factory.vehicle.BikeFactory;
import creational.factory.vehicle.CarFactory;
import creational.factory.vehicle.Vehicle;
import creational.factory.vehicle.VehicleFactory;

import java.util.List;

/**
 * Factory Method: the client drives whatever vehicle the factory hands it.
 */
@Demo(order = 10)
public class VehicleFactoryDemo implements PatternDemo {

    @Override
    public String name() {
        return "factory-method/vehicles";
    }

    @Override
    public void run(DemoContext context) {
        for (VehicleFactory factory : List.of(new CarFactory(), new BikeFactory())) {
            Vehicle vehicle = factory.createVehicle();
            context.out().println(vehicle.drive());
        }
    }
}
