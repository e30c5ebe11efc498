package home.purpleair.service.impl;

import home.purpleair.configuration.PollingConfiguration;
import home.purpleair.configuration.PurpleAirConfiguration;
import home.purpleair.enums.AqiConversion;
import home.purpleair.enums.CollectOutcome;
import home.purpleair.enums.PollErrorType;
import home.purpleair.enums.Pollutant;
import home.purpleair.event.error.SensorPollErrorEvent;
import home.purpleair.exception.SensorParseException;
import home.purpleair.model.FetchResult;
import home.purpleair.model.SensorReading;
import home.purpleair.service.AqiService;
import home.purpleair.service.CollectorService;
import home.purpleair.service.MetricsService;
import home.purpleair.service.SensorFetchService;
import home.purpleair.service.SensorParserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class CollectorServiceImpl implements CollectorService {
    private static final Logger logger = LoggerFactory.getLogger(CollectorServiceImpl.class);
    private final ApplicationEventPublisher applicationEventPublisher;
    private final PollingConfiguration pollingConfiguration;
    private final PurpleAirConfiguration purpleAirConfiguration;
    private final SensorFetchService sensorFetchService;
    private final SensorParserService sensorParserService;
    private final AqiService aqiService;
    private final MetricsService metricsService;

    public CollectorServiceImpl(
            ApplicationEventPublisher applicationEventPublisher,
            PollingConfiguration pollingConfiguration,
            PurpleAirConfiguration purpleAirConfiguration,
            SensorFetchService sensorFetchService,
            SensorParserService sensorParserService,
            AqiService aqiService,
            MetricsService metricsService
    ) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.pollingConfiguration = pollingConfiguration;
        this.purpleAirConfiguration = purpleAirConfiguration;
        this.sensorFetchService = sensorFetchService;
        this.sensorParserService = sensorParserService;
        this.aqiService = aqiService;
        this.metricsService = metricsService;
    }

    @Override
    public void collectAll() {
        Map<CollectOutcome, Integer> outcomes = new EnumMap<>(CollectOutcome.class);
        for (CollectOutcome outcome : CollectOutcome.values()) {
            outcomes.put(outcome, 0);
        }
        for (String unitId : pollingConfiguration.getSensorIds()) {
            outcomes.merge(collect(unitId), 1, Integer::sum);
        }
        logger.info(
            "Опрос завершен - {} {}, {} {}, {} {}, {} {}",
            CollectOutcome.COLLECTED.getTemplate(), outcomes.get(CollectOutcome.COLLECTED),
            CollectOutcome.EMPTY.getTemplate(), outcomes.get(CollectOutcome.EMPTY),
            CollectOutcome.THROTTLED.getTemplate(), outcomes.get(CollectOutcome.THROTTLED),
            CollectOutcome.FAILED.getTemplate(), outcomes.get(CollectOutcome.FAILED)
        );
    }

    @Override
    public CollectOutcome collect(String unitId) {
        logger.info("Собираем данные с устройства {}", unitId);
        try {
            return collectUnit(unitId);
        } catch (RuntimeException e) {
            logger.error("Непредвиденная ошибка опроса устройства {}", unitId, e);
            publishPollErrorEvent(unitId, PollErrorType.TRANSPORT_FAILURE);
            return CollectOutcome.FAILED;
        }
    }

    private CollectOutcome collectUnit(String unitId) {
        URI uri = purpleAirConfiguration.getSensorUri(unitId);
        FetchResult fetchResult = sensorFetchService.fetch(uri);

        switch (fetchResult.getStatus()) {
            case THROTTLED:
                logger.warn("Устройство {} - {}, пропускаем до следующего опроса", unitId,
                        fetchResult.getStatus().getTemplate());
                return CollectOutcome.THROTTLED;
            case FAILURE:
                logger.error("Ошибка запроса {}: {}", uri, fetchResult.getReason());
                publishPollErrorEvent(unitId, PollErrorType.TRANSPORT_FAILURE);
                return CollectOutcome.FAILED;
            default:
                break;
        }

        List<SensorReading> readings;
        try {
            readings = sensorParserService.parse(unitId, fetchResult.getBody(), purpleAirConfiguration.getVariant());
        } catch (SensorParseException e) {
            logger.error("Не удалось разобрать ответ устройства {}", unitId, e);
            publishPollErrorEvent(unitId, PollErrorType.PARSE_FAILURE);
            return CollectOutcome.FAILED;
        }

        if (readings.isEmpty()) {
            logger.warn("Устройство {} не вернуло ни одного датчика", unitId);
            return CollectOutcome.EMPTY;
        }

        for (SensorReading reading : readings) {
            metricsService.recordReading(reading);
            recordAqi(reading);
        }
        logger.debug("Устройство {} - записаны показания {} датчиков", unitId, readings.size());
        return CollectOutcome.COLLECTED;
    }

    private void recordAqi(SensorReading reading) {
        for (Pollutant pollutant : Pollutant.values()) {
            Double pm = reading.getValue(pollutant.getSourceMetric());
            if (pm == null) {
                continue;
            }
            for (AqiConversion conversion : AqiConversion.values()) {
                metricsService.recordAqi(reading, pollutant, aqiService.compute(pm, pollutant, conversion));
            }
        }
    }

    private void publishPollErrorEvent(String unitId, PollErrorType type) {
        logger.debug("Отправляем событие об ошибке опроса устройства {}", unitId);
        applicationEventPublisher.publishEvent(new SensorPollErrorEvent(this, unitId, type));
    }
}
