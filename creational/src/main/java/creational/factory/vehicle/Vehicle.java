package creational.factory.vehicle;

/**
 * Product created by a {@link VehicleFactory}.
 */
public interface Vehicle {

    /**
     * Describes driving this vehicle.
     */
    String drive();
}
