package home.purpleair;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import home.purpleair.scheduler.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TickerTest {
    private static final Duration INTERVAL = Duration.ofSeconds(10);

    /* время в наносекундах, двигается работой тика и паузами */
    private final long[] now = {0};
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Long> tickStarts = new ArrayList<>();
    private final ListAppender<ILoggingEvent> logAppender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        logAppender.start();
        tickerLogger().addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        tickerLogger().detachAppender(logAppender);
    }

    private Logger tickerLogger() {
        return (Logger) LoggerFactory.getLogger(Ticker.class);
    }

    private Ticker newTicker() {
        return new Ticker(INTERVAL, () -> now[0], duration -> {
            sleeps.add(duration);
            now[0] += duration.toNanos();
        });
    }

    private void runWithWork(Ticker ticker, long... workSeconds) throws InterruptedException {
        AtomicInteger tick = new AtomicInteger();
        ticker.run(() -> {
            int index = tick.getAndIncrement();
            tickStarts.add(now[0]);
            now[0] += Duration.ofSeconds(workSeconds[index]).toNanos();
            if (index == workSeconds.length - 1) {
                ticker.stop();
            }
        });
    }

    private long warnCount() {
        return logAppender.list.stream().filter(event -> event.getLevel() == Level.WARN).count();
    }

    @Test
    @DisplayName("Проверка что время работы вычитается из паузы")
    void checkSleepCompensatesWork() throws InterruptedException {
        runWithWork(newTicker(), 3, 1, 9);

        assertEquals(List.of(Duration.ofSeconds(7), Duration.ofSeconds(9), Duration.ofSeconds(1)), sleeps);
        assertEquals(0, warnCount());
    }

    @Test
    @DisplayName("Проверка что при превышении периода пауза нулевая и пишется предупреждение")
    void checkOverrun() throws InterruptedException {
        runWithWork(newTicker(), 15, 2);

        assertEquals(Duration.ZERO, sleeps.get(0));
        assertEquals(Duration.ofSeconds(8), sleeps.get(1));
        assertEquals(1, warnCount());
    }

    @Test
    @DisplayName("Проверка что дрейф не накапливается")
    void checkNoDrift() throws InterruptedException {
        long[] work = new long[50];
        for (int i = 0; i < work.length; i++) {
            work[i] = i % 10;
        }
        /* одно превышение периода на 4 секунды в середине */
        work[20] = 14;

        runWithWork(newTicker(), work);

        for (int i = 0; i < work.length; i++) {
            long expected = Duration.ofSeconds(10L * i).toNanos();
            long lateness = tickStarts.get(i) - expected;
            if (i <= 20) {
                assertEquals(0, lateness, "тик " + i);
            } else {
                /* отставание равно единственному превышению, а не растет с числом тиков */
                assertEquals(Duration.ofSeconds(4).toNanos(), lateness, "тик " + i);
            }
        }
    }

    @Test
    @DisplayName("Проверка остановки изнутри тика")
    void checkStopFromTick() throws InterruptedException {
        Ticker ticker = newTicker();
        AtomicInteger ticks = new AtomicInteger();
        ticker.run(() -> {
            if (ticks.incrementAndGet() == 3) {
                ticker.stop();
            }
        });

        assertEquals(3, ticks.get());
        assertFalse(ticker.isRunning());
    }

    @Test
    @DisplayName("Проверка что остановка из другого потока сразу завершает паузу")
    void checkStopReleasesPause() throws InterruptedException {
        Ticker ticker = new Ticker(Duration.ofSeconds(60));
        CountDownLatch firstTick = new CountDownLatch(1);
        AtomicInteger ticks = new AtomicInteger();
        Thread thread = new Thread(() -> {
            try {
                ticker.run(() -> {
                    ticks.incrementAndGet();
                    firstTick.countDown();
                });
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        thread.start();

        assertTrue(firstTick.await(2, TimeUnit.SECONDS));
        ticker.stop();
        thread.join(2000);

        assertFalse(thread.isAlive());
        assertEquals(1, ticks.get());
    }

    @Test
    @DisplayName("Проверка что остановленный тикер не запускает работу")
    void checkStoppedBeforeRun() throws InterruptedException {
        Ticker ticker = newTicker();
        assertTrue(ticker.isRunning());
        ticker.stop();

        AtomicInteger ticks = new AtomicInteger();
        ticker.run(ticks::incrementAndGet);

        assertEquals(0, ticks.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Проверка что прерывание паузы завершает цикл")
    void checkInterruptedSleep() {
        Ticker ticker = new Ticker(INTERVAL, () -> now[0], duration -> {
            throw new InterruptedException();
        });
        AtomicInteger ticks = new AtomicInteger();

        assertThrows(InterruptedException.class, () -> ticker.run(ticks::incrementAndGet));
        assertEquals(1, ticks.get());
    }

    @Test
    @DisplayName("Проверка что нулевой период запрещен")
    void checkInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new Ticker(Duration.ZERO));
    }
}
