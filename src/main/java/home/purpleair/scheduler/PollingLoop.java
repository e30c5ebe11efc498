package home.purpleair.scheduler;

import home.purpleair.configuration.PollingConfiguration;
import home.purpleair.service.CollectorService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Фоновый поток опроса датчиков. Отключается через polling.enabled=false
 */
@Component
@ConditionalOnProperty(name = "polling.enabled", havingValue = "true", matchIfMissing = true)
public class PollingLoop {
    private static final Logger logger = LoggerFactory.getLogger(PollingLoop.class);
    private static final long STOP_TIMEOUT_MILLIS = 30_000;
    private final CollectorService collectorService;
    private final PollingConfiguration pollingConfiguration;
    private final Ticker ticker;
    private Thread pollingThread;

    public PollingLoop(CollectorService collectorService, PollingConfiguration pollingConfiguration) {
        this.collectorService = collectorService;
        this.pollingConfiguration = pollingConfiguration;
        this.ticker = new Ticker(pollingConfiguration.getInterval());
    }

    @PostConstruct
    public void start() {
        pollingThread = new Thread(this::poll, "purpleair-polling");
        pollingThread.setDaemon(true);
        pollingThread.start();
        logger.info("Опрос запущен - устройства {}, период {} с", pollingConfiguration.getSensorIds(),
                pollingConfiguration.getInterval().getSeconds());
    }

    /**
     * Останавливает опрос и ждет завершения текущего тика. Запросы, которые уже выполняются, не прерываются
     */
    @PreDestroy
    public void stop() {
        ticker.stop();
        if (pollingThread != null) {
            try {
                pollingThread.join(STOP_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Прервано ожидание завершения потока опроса");
            }
            if (pollingThread.isAlive()) {
                logger.warn("Поток опроса не завершился за {} мс", STOP_TIMEOUT_MILLIS);
            } else {
                logger.info("Опрос остановлен");
            }
        }
    }

    private void poll() {
        try {
            ticker.run(this::tick);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Поток опроса прерван");
        } catch (Error e) {
            logger.error("Поток опроса аварийно завершен", e);
            throw e;
        }
    }

    private void tick() {
        try {
            collectorService.collectAll();
        } catch (RuntimeException e) {
            logger.error("Ошибка опроса, продолжаем со следующего тика", e);
        }
    }
}
