package vehicle;

public class EUVehicleFactory extends RegionalVehicleFactory {
    public static final String REGION_SPEC = "EU Spec";

    public EUVehicleFactory() {
        super(REGION_SPEC);
    }
}
