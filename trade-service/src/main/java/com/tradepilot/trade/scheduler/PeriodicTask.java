package com.tradepilot.trade.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * A fixed-rate engine task. Ticks never overlap: a tick that comes due while the
 * previous one is still running is dropped rather than queued. A failing tick is
 * logged and the loop carries on with the next one.
 */
public abstract class PeriodicTask {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected abstract String name();

    protected abstract Duration interval();

    /** One unit of work. */
    protected abstract Mono<?> tick();

    /**
     * Starts ticking on {@code timer}, first tick after one interval.
     *
     * @return handle that stops the loop when disposed
     */
    public Disposable start(Scheduler timer) {
        log.info("[{}] Started. intervalMs={}", name(), interval().toMillis());
        return Flux.interval(interval(), timer)
            .onBackpressureDrop(n -> log.debug("[{}] Tick skipped, previous still running. tick={}", name(), n))
            .concatMap(n -> Mono.defer(this::tick)
                .onErrorResume(e -> {
                    log.error("[{}] Tick failed. tick={}", name(), n, e);
                    return Mono.empty();
                }), 0)
            .doOnCancel(() -> log.info("[{}] Stopped.", name()))
            .subscribe();
    }
}
