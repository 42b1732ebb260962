package com.tradepilot.trade.engine;

import com.tradepilot.common.model.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketBoardTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("seeding gives 60 points per pair and the default quotes")
    void seed() {
        MarketBoard board = new MarketBoard(101);
        board.seed(List.of("BTC/USDT", "ETH/USDT", "SOL/USDT"), T0);

        List<Double> btc = board.history("BTC/USDT");
        assertEquals(60, btc.size());
        assertEquals(96000.0, btc.get(0));
        assertEquals(96000 + Math.sin(5.9) * 200 + 59 * 15, btc.get(59), 1e-9);
        assertEquals(0, new BigDecimal("198.50").compareTo(board.latestPrice("SOL/USDT").orElseThrow()));
        assertEquals(-0.15, board.latest("SOL/USDT").orElseThrow().pctChange24h());
    }

    @Test
    @DisplayName("history keeps only the most recent points")
    void bounded() {
        MarketBoard board = new MarketBoard(5);
        for (int i = 1; i <= 8; i++) {
            board.apply(new PriceQuote("ETH/USDT", BigDecimal.valueOf(i), 0.0, T0.plusSeconds(i)));
        }
        assertEquals(List.of(4.0, 5.0, 6.0, 7.0, 8.0), board.history("ETH/USDT"));
    }

    @Test
    @DisplayName("quote timestamps never move backwards")
    void monotonic() {
        MarketBoard board = new MarketBoard(10);
        board.apply(new PriceQuote("BTC/USDT", BigDecimal.TEN, 0.0, T0.plusSeconds(10)));
        PriceQuote stored = board.apply(new PriceQuote("BTC/USDT", BigDecimal.ONE, 0.0, T0));

        assertEquals(T0.plusSeconds(10), stored.timestamp());
        assertEquals(0, BigDecimal.ONE.compareTo(board.latestPrice("BTC/USDT").orElseThrow()));
    }

    @Test
    @DisplayName("unknown pairs have no history and no price")
    void unknown() {
        MarketBoard board = new MarketBoard(10);
        assertTrue(board.history("XRP/USDT").isEmpty());
        assertTrue(board.latestPrice("XRP/USDT").isEmpty());
    }
}
