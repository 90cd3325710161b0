package creational.factory.vehicle;

/**
 * Creator declaring the factory method for {@link Vehicle}s.
 *
 * <p>Each implementation decides which concrete vehicle to return, so client code depends
 * only on this interface and on {@link Vehicle}.
 *
 * <h2>Example:</h2>
 * <pre>
 * void travel(VehicleFactory factory) {
 *     System.out.println(factory.createVehicle().drive());
 * }
 *
 * travel(new CarFactory());
 * travel(new BikeFactory());
 * </pre>
 */
public interface VehicleFactory {

    /**
     * Creates a new vehicle.
     *
     * @return a new vehicle, never null
     */
    Vehicle createVehicle();
}
