package vehicle;

import java.util.Objects;

public abstract class RegionalVehicleFactory implements VehicleFactory {
    private final String regionSpec;

    protected RegionalVehicleFactory(String regionSpec) {
        this.regionSpec = Objects.requireNonNull(regionSpec, "regionSpec不能为空");
    }

    @Override
    public Vehicle createCar(String make, String model) {
        return new Car(make, model, regionSpec);
    }

    @Override
    public Vehicle createMotorcycle(String make, String model) {
        return new Motorcycle(make, model, regionSpec);
    }

    @Override
    public String getRegionSpec() { return regionSpec; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{regionSpec='" + regionSpec + '\'' + '}';
    }
}
