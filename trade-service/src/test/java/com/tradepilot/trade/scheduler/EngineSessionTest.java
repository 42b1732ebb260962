package com.tradepilot.trade.scheduler;

import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.common.model.Trade;
import com.tradepilot.common.model.TradeSide;
import com.tradepilot.common.model.TradeStatus;
import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.EngineEvent;
import com.tradepilot.trade.engine.EventLog;
import com.tradepilot.trade.engine.EventType;
import com.tradepilot.trade.engine.TradingEngine;
import com.tradepilot.trade.marketdata.MarketDataFeed;
import com.tradepilot.trade.marketdata.MarketSnapshot;
import com.tradepilot.trade.marketdata.SyntheticPriceWalk;
import com.tradepilot.trade.persistence.InMemoryPersistenceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EngineSessionTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private EngineProperties properties;
    private EventLog events;
    private TradingEngine engine;
    private final AtomicReference<MarketDataFeed> feed = new AtomicReference<>();
    private MarketFeedScheduler feedScheduler;
    private EngineSession session;
    private VirtualTimeScheduler timer;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.setAutoStart(false);
        properties.setFeedTimeout(Duration.ofMillis(200));
        events = new EventLog(properties, CLOCK);
        engine = new TradingEngine(properties, new InMemoryPersistenceStore(), events, CLOCK);
        feed.set((pairs, proxy) -> Mono.error(new IllegalStateException("offline")));

        MarketDataFeed delegating = (pairs, proxy) -> feed.get().poll(pairs, proxy);
        feedScheduler = new MarketFeedScheduler(engine, delegating, new SyntheticPriceWalk(new Random(3), CLOCK), properties);
        session = new EngineSession(engine, feedScheduler, new AutopilotScheduler(engine, properties),
                                    new SettlementScheduler(engine, properties), properties);
        timer = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        session.shutdown();
        engine.shutdown();
        timer.dispose();
    }

    private void quote(String pair, String price) {
        engine.applyMarketSnapshot(new MarketSnapshot(
            Map.of(pair, new PriceQuote(pair, new BigDecimal(price), 0.0, CLOCK.instant())), 100, false)).block();
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("auto-start disabled leaves the engine idle")
        void initWithoutAutoStart() {
            session.init();
            assertFalse(session.isRunning());
            assertFalse(engine.isActive());
        }

        @Test
        @DisplayName("start activates the engine once, stop deactivates it")
        void startStop() {
            assertTrue(session.start(timer));
            assertFalse(session.start(timer));
            assertTrue(session.isRunning());
            assertTrue(engine.isActive());

            assertTrue(session.stop());
            assertFalse(session.stop());
            assertFalse(session.isRunning());
            assertFalse(engine.isActive());
        }
    }

    @Nested
    @DisplayName("periodic work")
    class PeriodicTests {

        @Test
        @DisplayName("the settlement loop closes a triggered trade after one interval")
        void settlementTick() {
            session.start(timer);
            quote("SOL/USDT", "100");
            Trade trade = engine.openTrade("SOL/USDT", TradeSide.BUY, new BigDecimal("100"), null).block();
            quote("SOL/USDT", "97");

            timer.advanceTimeBy(Duration.ofSeconds(4));
            assertEquals(TradeStatus.OPEN, engine.trades(null).block().get(0).status());

            timer.advanceTimeBy(Duration.ofSeconds(1));
            Trade settled = engine.trades(null).block().get(0);
            assertEquals(trade.id(), settled.id());
            assertEquals(TradeStatus.CLOSED, settled.status());
        }

        @Test
        @DisplayName("no tick does work after the session stops")
        void stoppedSessionIsIdle() {
            session.start(timer);
            quote("SOL/USDT", "100");
            engine.openTrade("SOL/USDT", TradeSide.BUY, new BigDecimal("100"), null).block();
            quote("SOL/USDT", "97");
            session.stop();

            timer.advanceTimeBy(Duration.ofSeconds(30));
            assertEquals(TradeStatus.OPEN, engine.trades(null).block().get(0).status());
        }
    }

    @Nested
    @DisplayName("market feed tick")
    class FeedTickTests {

        @BeforeEach
        void activate() {
            engine.activate();
        }

        @Test
        @DisplayName("a failing feed is replaced by the synthetic walk")
        void failingFeed() {
            Map<String, PriceQuote> quotes = feedScheduler.tick().block();

            assertEquals(properties.getPairs().size(), quotes.size());
            assertTrue(engine.status().block().syntheticFeed());
            List<EngineEvent> recent = events.recent();
            assertTrue(recent.stream().anyMatch(e -> e.type() == EventType.WARNING
                                                     && e.message().contains("Synthetic prices active")));
        }

        @Test
        @DisplayName("a feed slower than the timeout is replaced by the synthetic walk")
        void slowFeed() {
            feed.set((pairs, proxy) -> Mono.never());
            feedScheduler.tick().block(Duration.ofSeconds(5));
            assertTrue(engine.status().block().syntheticFeed());
        }

        @Test
        @DisplayName("a live poll after synthetic prices restores the feed")
        void restored() {
            feedScheduler.tick().block();
            feed.set((pairs, proxy) -> Mono.just(new MarketSnapshot(
                Map.of("BTC/USDT", new PriceQuote("BTC/USDT", new BigDecimal("97000"), 1.0, CLOCK.instant())),
                80, false)));

            Map<String, PriceQuote> quotes = feedScheduler.tick().block();

            assertEquals(0, new BigDecimal("97000").compareTo(quotes.get("BTC/USDT").price()));
            assertFalse(engine.status().block().syntheticFeed());
            assertEquals(80, engine.status().block().feedLatencyMs());
            assertEquals(EventType.SUCCESS, events.recent().get(0).type());
        }
    }
}
