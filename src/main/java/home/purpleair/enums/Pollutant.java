package home.purpleair.enums;

import home.purpleair.model.BreakpointTable;

/**
 * Загрязнители, для которых считается AQI.
 * Таблицы по документу AirNow "Technical Assistance Document for the Reporting of Daily Air Quality", 2018.
 */
public enum Pollutant {
    PM2_5
            (
                    SensorMetric.PM2_5,
                    "aqi_pm2_5",
                    "AQI по PM2.5",
                    BreakpointTable.of(
                            0, 0,
                            12.1, 51,
                            35.5, 101,
                            55.5, 151,
                            150.5, 201,
                            250.5, 301,
                            350.5, 401
                    )
            ),

    PM10_0
            (
                    SensorMetric.PM10_0,
                    "aqi_pm10_0",
                    "AQI по PM10",
                    BreakpointTable.of(
                            0, 0,
                            55, 51,
                            155, 101,
                            255, 151,
                            355, 201,
                            425, 301,
                            505, 401
                    )
            );

    private final SensorMetric sourceMetric;

    private final String aqiMetricName;

    private final String template;

    private final BreakpointTable table;

    Pollutant(SensorMetric sourceMetric,
              String aqiMetricName,
              String template,
              BreakpointTable table) {
        this.sourceMetric = sourceMetric;
        this.aqiMetricName = aqiMetricName;
        this.template = template;
        this.table = table;
    }

    /**
     * Сырое показание датчика, из которого считается AQI
     */
    public SensorMetric getSourceMetric() {
        return sourceMetric;
    }

    public String getAqiMetricName() {
        return aqiMetricName;
    }

    public String getTemplate() {
        return template;
    }

    public BreakpointTable getTable() {
        return table;
    }
}
