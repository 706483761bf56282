package vehicle;

import common.LoggingConfig;

public class VehicleDemo {
    public static void main(String[] args) {
        LoggingConfig.setup();

        VehicleFactory usFactory = new USVehicleFactory();
        VehicleFactory euFactory = new EUVehicleFactory();

        Vehicle car = euFactory.createCar("Toyota", "Corolla");
        Vehicle motorcycle = usFactory.createMotorcycle("Harley-Davidson", "Sportster");

        car.startEngine();
        motorcycle.startEngine();
    }
}
