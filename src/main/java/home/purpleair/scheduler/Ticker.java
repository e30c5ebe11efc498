package home.purpleair.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Запускает работу с фиксированным периодом. Время, потраченное на саму работу, вычитается из паузы,
 * поэтому дрейф не накапливается. Если работа заняла больше периода, следующая итерация начинается сразу,
 * пропущенные тики не догоняются.
 */
public class Ticker {
    private static final Logger logger = LoggerFactory.getLogger(Ticker.class);
    private final Duration interval;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final AtomicBoolean running = new AtomicBoolean(true);
    /* отпускается в stop(), прерывает только паузу между тиками */
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public Ticker(Duration interval) {
        this.interval = checkInterval(interval);
        this.nanoClock = System::nanoTime;
        this.sleeper = this::awaitStop;
    }

    public Ticker(Duration interval, LongSupplier nanoClock, Sleeper sleeper) {
        this.interval = checkInterval(interval);
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    private static Duration checkInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Период должен быть положительным, задан " + interval);
        }
        return interval;
    }

    private void awaitStop(Duration duration) throws InterruptedException {
        if (stopSignal.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
            logger.debug("Пауза прервана остановкой тикера");
        }
    }

    /**
     * Крутит цикл до вызова {@link #stop()}. Флаг проверяется в начале каждой итерации,
     * выполняющаяся работа не прерывается.
     *
     * @param tick работа одной итерации
     * @throws InterruptedException если поток прервали во время паузы
     */
    public void run(Runnable tick) throws InterruptedException {
        logger.debug("Тикер запущен с периодом {} с", interval.toMillis() / 1000.0);
        while (running.get()) {
            logger.debug("tick");
            long start = nanoClock.getAsLong();
            tick.run();
            long end = nanoClock.getAsLong();

            Duration sleepTime = interval.minusNanos(end - start);
            if (sleepTime.isNegative()) {
                logger.warn("Итерация заняла больше {} с", interval.toMillis() / 1000.0);
                sleepTime = Duration.ZERO;
            }
            logger.info("Пауза {} с", sleepTime.toMillis() / 1000.0);
            sleeper.sleep(sleepTime);
        }
        logger.debug("Тикер остановлен");
    }

    /**
     * Останавливает цикл. Текущая итерация доработает до конца, пауза после нее завершится сразу.
     */
    public void stop() {
        running.set(false);
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
