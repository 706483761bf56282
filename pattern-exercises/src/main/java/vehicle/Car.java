package vehicle;

import java.util.Objects;
import java.util.logging.Logger;

public class Car implements Vehicle {
    private static final Logger LOG = Logger.getLogger(Car.class.getName());

    private final String make;
    private final String model;
    private final String regionSpec;   // 由工厂给定，例如 "US Spec"

    public Car(String make, String model, String regionSpec) {
        this.make = Objects.requireNonNull(make, "make不能为空");
        this.model = Objects.requireNonNull(model, "model不能为空");
        this.regionSpec = Objects.requireNonNull(regionSpec, "regionSpec不能为空");
    }

    @Override
    public void startEngine() {
        LOG.info(getDisplayName() + ": Engine started");
    }

    @Override public String getMake() { return make; }
    @Override public String getModel() { return model; }
    @Override public String getRegionSpec() { return regionSpec; }

    @Override
    public String toString() {
        return "Car{make='" + make + '\'' + ", model='" + model + '\'' + ", regionSpec='" + regionSpec + '\'' + '}';
    }
}
