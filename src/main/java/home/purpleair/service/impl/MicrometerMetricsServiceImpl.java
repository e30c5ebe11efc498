package home.purpleair.service.impl;

import home.purpleair.enums.Pollutant;
import home.purpleair.enums.SensorMetric;
import home.purpleair.event.error.SensorPollErrorEvent;
import home.purpleair.model.AqiResult;
import home.purpleair.model.SensorReading;
import home.purpleair.service.MetricsService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class MicrometerMetricsServiceImpl implements MetricsService {
    public static final String METRIC_PREFIX = "purpleair_";
    public static final String FETCH_ERRORS = METRIC_PREFIX + "fetch_errors";
    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsServiceImpl.class);
    private final MeterRegistry meterRegistry;
    private final Counter fetchErrors;
    /* micrometer держит gauge по слабой ссылке, поэтому значения храним сами */
    private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    public MicrometerMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.fetchErrors = Counter.builder(FETCH_ERRORS)
                .description("Ошибки получения данных с датчиков PurpleAir")
                .register(meterRegistry);
    }

    @Override
    public void recordReading(SensorReading reading) {
        Tags tags = sensorTags(reading);
        reading.getValues().forEach((metric, value) ->
                setGauge(METRIC_PREFIX + metric.getMetricName(), metric.getTemplate(), tags, value));
    }

    @Override
    public void recordAqi(SensorReading reading, Pollutant pollutant, AqiResult result) {
        Tags tags = sensorTags(reading).and("conversion", result.getConversion().getLabel());
        setGauge(METRIC_PREFIX + pollutant.getAqiMetricName(), pollutant.getTemplate(), tags, result.getAqi());
    }

    @Override
    public void incrementFetchErrors() {
        fetchErrors.increment();
    }

    @EventListener
    public void onSensorPollErrorEvent(SensorPollErrorEvent event) {
        logger.debug("Учитываем ошибку опроса устройства {}: {}", event.getUnitId(), event.getType().getTemplate());
        incrementFetchErrors();
    }

    private Tags sensorTags(SensorReading reading) {
        return Tags.of(
                "unit_id", reading.getUnitId(),
                "sensor_id", reading.getSensorId(),
                "label", reading.getLabel()
        );
    }

    private void setGauge(String name, String description, Tags tags, double value) {
        AtomicLong holder = gaugeValues.computeIfAbsent(name + tags, key -> {
            AtomicLong bits = new AtomicLong(Double.doubleToLongBits(Double.NaN));
            Gauge.builder(name, bits, b -> Double.longBitsToDouble(b.get()))
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            return bits;
        });
        holder.set(Double.doubleToLongBits(value));
    }
}
