package com.tradepilot.trade.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicTaskTest {

    private final VirtualTimeScheduler timer = VirtualTimeScheduler.create();

    @AfterEach
    void tearDown() {
        timer.dispose();
    }

    /** Ticks every 10 s; each tick takes {@code work} of virtual time. */
    private PeriodicTask task(Duration work, List<Long> startedAt, AtomicBoolean failFirst) {
        return new PeriodicTask() {
            @Override
            protected String name() {
                return "Test";
            }

            @Override
            protected Duration interval() {
                return Duration.ofSeconds(10);
            }

            @Override
            protected Mono<?> tick() {
                startedAt.add(timer.now(TimeUnit.SECONDS));
                if (failFirst.compareAndSet(true, false)) {
                    return Mono.error(new IllegalStateException("boom"));
                }
                return Mono.delay(work, timer);
            }
        };
    }

    @Test
    @DisplayName("ticks that come due while one is running are dropped, not queued")
    void overdueTicksDropped() {
        List<Long> startedAt = new CopyOnWriteArrayList<>();
        Disposable running = task(Duration.ofSeconds(25), startedAt, new AtomicBoolean(false)).start(timer);

        timer.advanceTimeTo(Instant.ofEpochSecond(100));
        running.dispose();

        assertEquals(List.of(10L, 40L, 70L, 100L), startedAt);
    }

    @Test
    @DisplayName("a failing tick does not stop the loop")
    void failureSkipped() {
        List<Long> startedAt = new CopyOnWriteArrayList<>();
        Disposable running = task(Duration.ofSeconds(1), startedAt, new AtomicBoolean(true)).start(timer);

        timer.advanceTimeBy(Duration.ofSeconds(30));
        running.dispose();

        assertEquals(List.of(10L, 20L, 30L), startedAt);
    }

    @Test
    @DisplayName("disposing the handle stops further ticks")
    void disposeStops() {
        List<Long> startedAt = new CopyOnWriteArrayList<>();
        Disposable running = task(Duration.ofSeconds(1), startedAt, new AtomicBoolean(false)).start(timer);

        timer.advanceTimeBy(Duration.ofSeconds(10));
        running.dispose();
        timer.advanceTimeBy(Duration.ofSeconds(50));

        assertEquals(List.of(10L), startedAt);
    }
}
