package home.purpleair.enums;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Вариант API PurpleAir. Каждый вариант сам знает формат URL и имена полей в ответе,
 * общей таблицы соответствий нет.
 */
public enum SchemaVariant {
    LEGACY
            (
                    "https://www.purpleair.com",
                    "старый JSON API (/json?show=)",
                    Map.of(
                            SensorMetric.PM2_5, "pm2_5_atm",
                            SensorMetric.PM10_0, "pm10_0_atm",
                            SensorMetric.TEMP_F, "temp_f",
                            SensorMetric.PRESSURE, "pressure",
                            SensorMetric.HUMIDITY, "humidity",
                            SensorMetric.LAST_SEEN, "LastSeen"
                    )
            ) {
        @Override
        public URI buildUri(String baseUrl, String unitId, String apiToken) {
            return URI.create(baseUrl + "/json?show=" + encode(unitId));
        }
    },

    CURRENT
            (
                    "https://api.purpleair.com",
                    "API v1 (/v1/sensors/)",
                    Map.of(
                            SensorMetric.PM2_5, "pm2.5",
                            SensorMetric.PM10_0, "pm10.0",
                            SensorMetric.TEMP_F, "temperature",
                            SensorMetric.PRESSURE, "pressure",
                            SensorMetric.HUMIDITY, "humidity",
                            SensorMetric.LAST_SEEN, "last_seen"
                    )
            ) {
        @Override
        public URI buildUri(String baseUrl, String unitId, String apiToken) {
            return URI.create(baseUrl + "/v1/sensors/" + encode(unitId)
                    + "?token=" + encode(apiToken)
                    + "&fields=" + requestedFields());
        }
    };

    private final String defaultBaseUrl;

    private final String template;

    private final Map<SensorMetric, String> fieldNames;

    SchemaVariant(String defaultBaseUrl,
                  String template,
                  Map<SensorMetric, String> fieldNames) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.template = template;
        this.fieldNames = new EnumMap<>(fieldNames);
    }

    /**
     * Собирает URL запроса показаний одного устройства
     *
     * @param baseUrl  схема и хост API без завершающего слэша
     * @param unitId   идентификатор устройства из конфигурации
     * @param apiToken ключ API, для старого варианта не используется
     * @return готовый URL
     */
    public abstract URI buildUri(String baseUrl, String unitId, String apiToken);

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getTemplate() {
        return template;
    }

    public String fieldName(SensorMetric metric) {
        return fieldNames.get(metric);
    }

    /* name нужен для метки, sensor_index API отдает всегда */
    String requestedFields() {
        return "name," + Arrays.stream(SensorMetric.values())
                .map(this::fieldName)
                .collect(Collectors.joining(","));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
