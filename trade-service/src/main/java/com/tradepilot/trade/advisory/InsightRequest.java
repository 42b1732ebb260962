package com.tradepilot.trade.advisory;

import java.util.List;

/**
 * Inputs for one insight: what the engine currently knows about a pair.
 *
 * @param pair          pair symbol
 * @param currentPrice  latest price, null when no quote exists
 * @param pctChange24h  24h change in percent, null when no quote exists
 * @param history       close history, oldest first
 */
public record InsightRequest(String pair, Double currentPrice, Double pctChange24h, List<Double> history) {

    public InsightRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean hasQuote() {
        return currentPrice != null && currentPrice > 0 && Double.isFinite(currentPrice);
    }
}
