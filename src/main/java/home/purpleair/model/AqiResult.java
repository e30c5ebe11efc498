package home.purpleair.model;

import home.purpleair.enums.AqiConversion;

public class AqiResult {
    private final double aqi;
    private final AqiConversion conversion;

    public AqiResult(double aqi, AqiConversion conversion) {
        this.aqi = aqi;
        this.conversion = conversion;
    }

    public double getAqi() {
        return aqi;
    }

    public AqiConversion getConversion() {
        return conversion;
    }
}
