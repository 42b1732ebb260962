package com.tradepilot.common.analysis;

import com.tradepilot.common.model.SignalAction;
import com.tradepilot.common.model.TrendSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private static List<Double> linear(int size, double start, double step) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < size; i++) prices.add(start + i * step);
        return prices;
    }

    @Nested
    @DisplayName("analyzeTrend() classification")
    class ClassificationTests {

        @Test
        @DisplayName("steady rise → BUY")
        void risingSeries_buy() {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(linear(60, 100.0, 0.5));
            assertEquals(SignalAction.BUY, signal.action());
            assertTrue(signal.confidence() > 50, "Expected confidence above base but got " + signal.confidence());
        }

        @Test
        @DisplayName("steady decline → SELL")
        void fallingSeries_sell() {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(linear(60, 200.0, -0.5));
            assertEquals(SignalAction.SELL, signal.action());
        }

        @Test
        @DisplayName("flat series → HOLD at base confidence")
        void flatSeries_hold() {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(Collections.nCopies(60, 100.0));
            assertEquals(SignalAction.HOLD, signal.action());
            assertEquals(50, signal.confidence());
        }

        @Test
        @DisplayName("tiny drift inside neutral band → HOLD")
        void tinyDrift_hold() {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(linear(60, 10_000.0, 0.01));
            assertEquals(SignalAction.HOLD, signal.action());
        }

        @Test
        @DisplayName("seeded BTC-style sinusoid with upward drift → BUY")
        void seededUptrend_buy() {
            List<Double> prices = new ArrayList<>();
            for (int i = 0; i < 60; i++) prices.add(96_000 + Math.sin(i / 10.0) * 200 + i * 15);
            assertEquals(SignalAction.BUY, TrendAnalyzer.analyzeTrend(prices).action());
        }
    }

    @Nested
    @DisplayName("analyzeTrend() edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("null history → HOLD with zero confidence")
        void nullHistory() {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(null);
            assertEquals(SignalAction.HOLD, signal.action());
            assertEquals(0, signal.confidence());
        }

        @Test
        @DisplayName("fewer points than the short window → HOLD")
        void tooShort() {
            assertEquals(SignalAction.HOLD, TrendAnalyzer.analyzeTrend(linear(5, 100.0, 10.0)).action());
        }

        @Test
        @DisplayName("NaN in history → HOLD")
        void nonFinite() {
            List<Double> prices = linear(60, 100.0, 1.0);
            prices.set(30, Double.NaN);
            assertEquals(SignalAction.HOLD, TrendAnalyzer.analyzeTrend(prices).action());
        }
    }

    @Nested
    @DisplayName("confidence")
    class ConfidenceTests {

        @Test
        @DisplayName("bounded to [0, 100] and monotone in momentum magnitude")
        void boundedAndMonotone() {
            int previous = -1;
            for (double m = 0.0; m <= 5.0; m += 0.05) {
                int c = TrendAnalyzer.confidence(m);
                assertTrue(c >= 0 && c <= 100, "confidence out of range: " + c);
                assertTrue(c >= previous, "confidence decreased at momentum " + m);
                assertEquals(c, TrendAnalyzer.confidence(-m), "confidence must depend on magnitude only");
                previous = c;
            }
        }

        @Test
        @DisplayName("steeper trend never yields lower confidence")
        void steeperTrend() {
            int gentle = TrendAnalyzer.analyzeTrend(linear(60, 100.0, 0.2)).confidence();
            int steep  = TrendAnalyzer.analyzeTrend(linear(60, 100.0, 1.0)).confidence();
            assertTrue(steep >= gentle);
        }
    }

    @Test
    @DisplayName("Deterministic: same input always produces same output")
    void deterministicBehavior() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 80; i++) prices.add(2_600 + Math.sin(i / 7.0) * 10 + i * 3);

        TrendSignal first = TrendAnalyzer.analyzeTrend(prices);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, TrendAnalyzer.analyzeTrend(List.copyOf(prices)),
                "Analysis must be deterministic on iteration " + i);
        }
    }
}
