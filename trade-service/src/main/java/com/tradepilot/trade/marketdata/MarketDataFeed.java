package com.tradepilot.trade.marketdata;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of live quotes. Implementations either return a quote for every requested
 * pair or fail the whole poll.
 */
public interface MarketDataFeed {

    /**
     * @param pairs       pairs to fetch, e.g. {@code BTC/USDT}
     * @param proxyPrefix prefix prepended to outbound URLs, empty for a direct call
     */
    Mono<MarketSnapshot> poll(List<String> pairs, String proxyPrefix);
}
