package home.purpleair.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import home.purpleair.enums.SchemaVariant;
import home.purpleair.enums.SensorMetric;
import home.purpleair.exception.SensorParseException;
import home.purpleair.model.SensorReading;
import home.purpleair.service.SensorParserService;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class SensorParserServiceImpl implements SensorParserService {
    private static final Logger logger = LoggerFactory.getLogger(SensorParserServiceImpl.class);
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<SensorReading> parse(String unitId, byte[] body, SchemaVariant variant) throws SensorParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SensorParseException("Ответ устройства " + unitId + " не является корректным JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new SensorParseException("Устройство " + unitId + " вернуло пустой ответ");
        }

        switch (variant) {
            case LEGACY:
                return parseLegacy(unitId, root);
            case CURRENT:
                return parseCurrent(unitId, root);
            default:
                throw new IllegalArgumentException("Неизвестный вариант API " + variant);
        }
    }

    private List<SensorReading> parseLegacy(String unitId, JsonNode root) {
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            logger.debug("В ответе устройства {} нет массива results", unitId);
            return List.of();
        }

        /* у большинства устройств два датчика, первую непустую метку вешаем на все */
        String label = "";
        for (JsonNode entry : results) {
            label = textOf(entry.path("Label"));
            if (!label.isEmpty()) {
                break;
            }
        }

        List<SensorReading> readings = new ArrayList<>();
        for (JsonNode entry : results) {
            if (!entry.isObject()) {
                continue;
            }
            readings.add(new SensorReading(unitId, textOf(entry.path("ID")), label,
                    extractValues(entry, SchemaVariant.LEGACY)));
        }
        return readings;
    }

    private List<SensorReading> parseCurrent(String unitId, JsonNode root) {
        JsonNode sensor = root.path("sensor");
        if (!sensor.isObject()) {
            logger.debug("В ответе устройства {} нет объекта sensor", unitId);
            return List.of();
        }
        return List.of(new SensorReading(unitId, textOf(sensor.path("sensor_index")), textOf(sensor.path("name")),
                extractValues(sensor, SchemaVariant.CURRENT)));
    }

    private Map<SensorMetric, Double> extractValues(JsonNode entry, SchemaVariant variant) {
        Map<SensorMetric, Double> values = new EnumMap<>(SensorMetric.class);
        for (SensorMetric metric : SensorMetric.values()) {
            JsonNode node = entry.path(variant.fieldName(metric));
            if (node.isMissingNode() || node.isNull()) {
                continue;
            }
            Double value = numericValue(node);
            if (value == null) {
                logger.debug("Поле {} содержит нечисловое значение {}, пропускаем", variant.fieldName(metric), node);
                continue;
            }
            values.put(metric, value);
        }
        return values;
    }

    /* старый API отдает часть чисел строками, например "pm2_5_atm": "12.3" */
    @Nullable
    private static Double numericValue(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static String textOf(JsonNode node) {
        if (node.isValueNode() && !node.isNull()) {
            return node.asText();
        }
        return "";
    }
}
