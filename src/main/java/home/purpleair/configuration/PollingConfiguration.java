package home.purpleair.configuration;

import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class PollingConfiguration {
    @Value("${polling.intervalSeconds:30}")
    private Integer intervalSeconds;

    @Value("${polling.sensorIds:}")
    private String sensorIds;

    private List<String> parsedSensorIds = List.of();

    /**
     * Без списка датчиков запускаться смысла нет - падаем на старте
     */
    @PostConstruct
    public void validate() {
        if (StringUtils.isBlank(sensorIds)) {
            throw new IllegalStateException("Не задан список датчиков (PAS_SENSOR_IDS)");
        }
        if (intervalSeconds == null || intervalSeconds < 1) {
            throw new IllegalStateException("Интервал опроса должен быть не меньше секунды, задан " + intervalSeconds);
        }
        List<String> ids = new ArrayList<>();
        for (String raw : sensorIds.split(",")) {
            String id = raw.trim();
            if (id.isEmpty()) {
                continue;
            }
            if (!StringUtils.isNumeric(id)) {
                throw new IllegalStateException("Идентификатор датчика должен быть числом: " + id);
            }
            ids.add(id);
        }
        if (ids.isEmpty()) {
            throw new IllegalStateException("Не задан список датчиков (PAS_SENSOR_IDS)");
        }
        parsedSensorIds = List.copyOf(ids);
    }

    public Duration getInterval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public List<String> getSensorIds() {
        return parsedSensorIds;
    }
}
