package com.tradepilot.trade.scheduler;

import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.TradingEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Starts and stops the market feed, autopilot and settlement loops together.
 * Stopping deactivates the engine before cancelling the loops, so a tick that is
 * already queued finds nothing to do.
 */
@Component
public class EngineSession {

    private static final Logger log = LoggerFactory.getLogger(EngineSession.class);

    private final TradingEngine engine;
    private final List<PeriodicTask> tasks;
    private final boolean autoStart;

    private Disposable.Composite running;

    public EngineSession(TradingEngine engine, MarketFeedScheduler feed, AutopilotScheduler autopilot,
                         SettlementScheduler settlement, EngineProperties properties) {
        this.engine    = engine;
        this.tasks     = List.of(feed, autopilot, settlement);
        this.autoStart = properties.isAutoStart();
    }

    @PostConstruct
    public void init() {
        if (autoStart) {
            start();
        } else {
            log.info("[EngineSession] Auto-start disabled. Waiting for an operator session.");
        }
    }

    public boolean start() {
        return start(Schedulers.parallel());
    }

    /**
     * @param timer scheduler driving the intervals
     * @return false when already running
     */
    public synchronized boolean start(Scheduler timer) {
        if (running != null) {
            return false;
        }
        engine.activate();
        Disposable.Composite composite = Disposables.composite();
        tasks.forEach(task -> composite.add(task.start(timer)));
        running = composite;
        log.info("[EngineSession] Periodic tasks started. tasks={}", tasks.size());
        return true;
    }

    /** @return false when nothing was running */
    public synchronized boolean stop() {
        if (running == null) {
            return false;
        }
        engine.deactivate();
        running.dispose();
        running = null;
        log.info("[EngineSession] Periodic tasks stopped.");
        return true;
    }

    public synchronized boolean isRunning() {
        return running != null;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }
}
