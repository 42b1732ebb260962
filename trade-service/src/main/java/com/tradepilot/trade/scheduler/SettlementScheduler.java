package com.tradepilot.trade.scheduler;

import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.TradingEngine;
import com.tradepilot.trade.ledger.Settlement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Sweeps OPEN trades for stop-loss and take-profit hits every {@code engine.settlement-interval}.
 */
@Component
public class SettlementScheduler extends PeriodicTask {

    private static final Logger log = LoggerFactory.getLogger(SettlementScheduler.class);

    private final TradingEngine engine;
    private final Duration interval;

    public SettlementScheduler(TradingEngine engine, EngineProperties properties) {
        this.engine   = engine;
        this.interval = properties.getSettlementInterval();
    }

    @Override
    protected String name() {
        return "Settlement";
    }

    @Override
    protected Duration interval() {
        return interval;
    }

    @Override
    protected Mono<List<Settlement>> tick() {
        return engine.runSettlementSweep()
            .doOnNext(settled -> settled.forEach(s ->
                log.info("[Settlement] Exit triggered. id={} pair={} pnlPct={} pnl={}",
                         s.trade().id(), s.trade().pair(), s.pnlPercent().doubleValue(), s.pnlValue())));
    }
}
