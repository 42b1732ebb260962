package com.tradepilot.trade.scheduler;

import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.TradingEngine;
import com.tradepilot.trade.marketdata.MarketDataFeed;
import com.tradepilot.trade.marketdata.SyntheticPriceWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Polls the market feed every {@code engine.feed-interval}. When the poll fails or
 * exceeds {@code engine.feed-timeout}, the synthetic walk supplies the next quotes.
 */
@Component
public class MarketFeedScheduler extends PeriodicTask {

    private static final Logger log = LoggerFactory.getLogger(MarketFeedScheduler.class);

    private final TradingEngine engine;
    private final MarketDataFeed feed;
    private final SyntheticPriceWalk walk;
    private final List<String> pairs;
    private final Duration interval;
    private final Duration feedTimeout;

    public MarketFeedScheduler(TradingEngine engine, MarketDataFeed feed, SyntheticPriceWalk walk,
                               EngineProperties properties) {
        this.engine      = engine;
        this.feed        = feed;
        this.walk        = walk;
        this.pairs       = List.copyOf(properties.getPairs());
        this.interval    = properties.getFeedInterval();
        this.feedTimeout = properties.getFeedTimeout();
    }

    @Override
    protected String name() {
        return "MarketFeed";
    }

    @Override
    protected Duration interval() {
        return interval;
    }

    @Override
    protected Mono<Map<String, PriceQuote>> tick() {
        return engine.riskConfiguration().zipWith(engine.quotes())
            .flatMap(state -> Mono.defer(() -> feed.poll(pairs, state.getT1().proxyPrefix()))
                .timeout(feedTimeout)
                .onErrorResume(e -> {
                    log.warn("[MarketFeed] Poll failed, using synthetic prices. reason={}", e.getMessage());
                    return Mono.fromCallable(() -> walk.step(pairs, state.getT2()));
                }))
            .doOnNext(snapshot -> log.debug("[MarketFeed] Poll complete. synthetic={} latencyMs={}",
                                            snapshot.synthetic(), snapshot.latencyMs()))
            .flatMap(engine::applyMarketSnapshot);
    }
}
