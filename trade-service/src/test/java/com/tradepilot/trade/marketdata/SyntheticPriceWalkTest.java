package com.tradepilot.trade.marketdata;

import com.tradepilot.common.model.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticPriceWalkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final List<String> PAIRS = List.of("BTC/USDT", "ETH/USDT", "SOL/USDT");

    @Test
    @DisplayName("each step stays within half the asset's walk step")
    void bounded() {
        SyntheticPriceWalk walk = new SyntheticPriceWalk(new Random(42), CLOCK);
        Map<String, PriceQuote> current = Map.of(
            "BTC/USDT", new PriceQuote("BTC/USDT", new BigDecimal("96000"), 1.0, Instant.EPOCH),
            "ETH/USDT", new PriceQuote("ETH/USDT", new BigDecimal("2600"), 0.5, Instant.EPOCH),
            "SOL/USDT", new PriceQuote("SOL/USDT", new BigDecimal("190"), -0.2, Instant.EPOCH));

        for (int i = 0; i < 200; i++) {
            MarketSnapshot next = walk.step(PAIRS, current);
            for (String pair : PAIRS) {
                double moved = next.quotes().get(pair).price().subtract(current.get(pair).price()).abs().doubleValue();
                assertTrue(moved <= AssetProfile.forPair(pair).walkStep() / 2 + 1e-4, pair + " moved " + moved);
                assertEquals(current.get(pair).pctChange24h(), next.quotes().get(pair).pctChange24h());
            }
            assertTrue(next.synthetic());
            assertTrue(next.latencyMs() >= 15 && next.latencyMs() <= 44);
            current = next.quotes();
        }
    }

    @Test
    @DisplayName("pairs without a quote start from the default price and never go below the floor")
    void defaultsAndFloor() {
        SyntheticPriceWalk walk = new SyntheticPriceWalk(new Random(7), CLOCK);
        MarketSnapshot first = walk.step(List.of("SOL/USDT"), Map.of());
        assertTrue(first.quotes().get("SOL/USDT").price().subtract(new BigDecimal("198.50")).abs().doubleValue() <= 2.5);

        Map<String, PriceQuote> tiny = Map.of("DOGE/USDT",
            new PriceQuote("DOGE/USDT", new BigDecimal("0.01"), 0.0, Instant.EPOCH));
        for (int i = 0; i < 20; i++) {
            tiny = walk.step(List.of("DOGE/USDT"), tiny).quotes();
            assertTrue(tiny.get("DOGE/USDT").price().compareTo(SyntheticPriceWalk.MIN_PRICE) >= 0);
        }
    }
}
