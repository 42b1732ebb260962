package com.tradepilot.trade.marketdata;

import com.tradepilot.common.model.PriceQuote;

import java.util.Map;

/**
 * One poll of the market feed.
 *
 * @param quotes    latest quote per pair
 * @param latencyMs round-trip time of the poll
 * @param synthetic true when the quotes came from the random walk rather than the exchange
 */
public record MarketSnapshot(Map<String, PriceQuote> quotes, long latencyMs, boolean synthetic) {}
