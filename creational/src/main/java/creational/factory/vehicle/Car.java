package creational.factory.vehicle;

public class Car implements Vehicle {

    @Override
    public String drive() {
        return "Driving a car";
    }
}
