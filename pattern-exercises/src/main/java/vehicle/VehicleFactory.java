package vehicle;

/**
 * 交通工具工厂：决定所造车辆的地区规格，车辆类本身不感知地区。
 */
public interface VehicleFactory {
    String getRegionSpec();

    Vehicle createCar(String make, String model);

    Vehicle createMotorcycle(String make, String model);
}
