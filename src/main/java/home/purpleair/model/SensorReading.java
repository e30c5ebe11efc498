package home.purpleair.model;

import home.purpleair.enums.SensorMetric;
import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Одно показание физического датчика внутри устройства PurpleAir.
 * Любое из полей может отсутствовать в ответе API, тогда его нет и в карте значений.
 */
public class SensorReading {
    private final String unitId;
    private final String sensorId;
    private final String label;
    private final Map<SensorMetric, Double> values;

    public SensorReading(String unitId, String sensorId, String label, Map<SensorMetric, Double> values) {
        this.unitId = unitId;
        this.sensorId = sensorId;
        this.label = label;
        this.values = values.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public String getUnitId() {
        return unitId;
    }

    public String getSensorId() {
        return sensorId;
    }

    public String getLabel() {
        return label;
    }

    @Nullable
    public Double getValue(SensorMetric metric) {
        return values.get(metric);
    }

    public boolean hasValue(SensorMetric metric) {
        return values.containsKey(metric);
    }

    public Map<SensorMetric, Double> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "SensorReading{unitId=" + unitId + ", sensorId=" + sensorId + ", label=" + label + ", values="
                + values + "}";
    }
}
