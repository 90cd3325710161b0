package creational.factory.vehicle;

public class Bike implements Vehicle {

    @Override
    public String drive() {
        return "Riding a bike";
    }
}
