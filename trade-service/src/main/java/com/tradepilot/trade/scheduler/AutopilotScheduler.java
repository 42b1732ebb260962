package com.tradepilot.trade.scheduler;

import com.tradepilot.common.model.Trade;
import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.TradingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Runs an autopilot cycle every {@code engine.autopilot-interval}.
 */
@Component
public class AutopilotScheduler extends PeriodicTask {

    private static final Logger log = LoggerFactory.getLogger(AutopilotScheduler.class);

    private final TradingEngine engine;
    private final Duration interval;

    public AutopilotScheduler(TradingEngine engine, EngineProperties properties) {
        this.engine   = engine;
        this.interval = properties.getAutopilotInterval();
    }

    @Override
    protected String name() {
        return "Autopilot";
    }

    @Override
    protected Duration interval() {
        return interval;
    }

    @Override
    protected Mono<List<Trade>> tick() {
        return engine.runAutopilotCycle()
            .doOnNext(opened -> {
                if (!opened.isEmpty()) {
                    log.info("[Autopilot] Cycle complete. opened={}", opened.size());
                }
            });
    }
}
