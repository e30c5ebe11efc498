package home.purpleair.enums;

public enum SensorMetric {
    PM2_5
            (
                    "pm2_5",
                    "Концентрация частиц PM2.5 (мкг/м³)"
            ),

    PM10_0
            (
                    "pm10_0",
                    "Концентрация частиц PM10 (мкг/м³)"
            ),

    TEMP_F
            (
                    "temp_f",
                    "Температура в градусах Фаренгейта"
            ),

    HUMIDITY
            (
                    "humidity",
                    "Влажность в процентах"
            ),

    PRESSURE
            (
                    "pressure",
                    "Давление в миллибарах"
            ),

    LAST_SEEN
            (
                    "last_seen_seconds",
                    "Время последнего выхода датчика на связь (unix-время)"
            );

    private final String metricName;

    private final String template;

    SensorMetric(String metricName,
                 String template) {
        this.metricName = metricName;
        this.template = template;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getTemplate() {
        return template;
    }
}
