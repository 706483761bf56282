package vehicle;

public class USVehicleFactory extends RegionalVehicleFactory {
    public static final String REGION_SPEC = "US Spec";

    public USVehicleFactory() {
        super(REGION_SPEC);
    }
}
