package vehicle;

/**
 * 交通工具能力：能启动引擎，并给出带地区规格的展示名称。
 */
public interface Vehicle {
    String getMake();
    String getModel();
    String getRegionSpec();

    void startEngine();

    default String getDisplayName() {
        return getMake() + " " + getModel() + " (" + getRegionSpec() + ")";
    }
}
