package home.purpleair;

import home.purpleair.configuration.PurpleAirConfiguration;
import home.purpleair.enums.SchemaVariant;
import home.purpleair.model.FetchResult;
import home.purpleair.service.CollectorService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

@TestPropertySource(properties = {
    "purpleair.variant = CURRENT",
    "purpleair.baseUrl = http://localhost:8089/",
    "purpleair.apiToken = test-token",
    "polling.sensorIds = 131075",
    "purpleair.connectTimeout = 3",
    "purpleair.requestTimeout = 7"
})
public class CurrentApiCollectorTest extends AbstractTest {

    @Autowired
    PurpleAirConfiguration purpleAirConfiguration;

    @Autowired
    CollectorService collectorService;

    @Autowired
    MeterRegistry meterRegistry;

    @Test
    @DisplayName("Проверка чтения таймаутов из настроек")
    void checkTimeouts() {
        assertEquals(Duration.ofSeconds(3), purpleAirConfiguration.getConnectTimeout());
        assertEquals(Duration.ofSeconds(7), purpleAirConfiguration.getRequestTimeout());
    }

    @Test
    @DisplayName("Проверка опроса через API v1")
    void checkCurrentVariant() {
        URI expected = URI.create("http://localhost:8089/v1/sensors/131075?token=test-token"
            + "&fields=name,pm2.5,pm10.0,temperature,humidity,pressure,last_seen");
        assertEquals(SchemaVariant.CURRENT, purpleAirConfiguration.getVariant());
        assertEquals(expected, purpleAirConfiguration.getSensorUri("131075"));

        Mockito.when(sensorFetchService.fetch(Mockito.any()))
            .thenReturn(FetchResult.success(SensorParserServiceTest.fixture("current-sensor.json")));

        collectorService.collectAll();

        Mockito.verify(sensorFetchService).fetch(expected);
        String[] tags = {"unit_id", "131075", "sensor_id", "131075", "label", "Mariners Bluff"};
        assertEquals(10.0, meterRegistry.get("purpleair_pm2_5").tags(tags).gauge().value());
        assertEquals(72.0, meterRegistry.get("purpleair_temp_f").tags(tags).gauge().value());
        assertEquals(42, (int) meterRegistry.get("purpleair_aqi_pm2_5").tags(tags).tag("conversion", "").gauge().value());
        /* PM10 = 400 попадает в интервал 355-425 */
        assertEquals(265, (int) meterRegistry.get("purpleair_aqi_pm10_0").tags(tags).tag("conversion", "").gauge().value());
    }
}
