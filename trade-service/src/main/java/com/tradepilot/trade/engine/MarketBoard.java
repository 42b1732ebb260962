package com.tradepilot.trade.engine;

import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.trade.marketdata.AssetProfile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Latest quote and bounded close history per pair, oldest price first.
 * Quote timestamps never go backwards for a pair.
 *
 * <p>Not thread-safe; owned by the single engine thread.
 */
public class MarketBoard {

    public static final int SEED_POINTS = 60;

    private final int capacity;
    private final Map<String, PriceQuote> latest = new LinkedHashMap<>();
    private final Map<String, Deque<Double>> history = new HashMap<>();

    public MarketBoard(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive");
        }
        this.capacity = capacity;
    }

    /** Seeds each pair with a deterministic warm-up series and its default quote. */
    public void seed(List<String> pairs, Instant now) {
        for (String pair : pairs) {
            AssetProfile profile = AssetProfile.forPair(pair);
            Deque<Double> series = new ArrayDeque<>();
            for (int i = 0; i < SEED_POINTS; i++) {
                series.addLast(profile.seedPrice(i));
            }
            trim(series);
            history.put(pair, series);
            latest.put(pair, new PriceQuote(pair, profile.defaultPrice(), profile.defaultChangePct(), now));
        }
    }

    /**
     * Records a quote and appends its price to the pair's history.
     *
     * @return the stored quote, with its timestamp raised to the previous one if it was older
     */
    public PriceQuote apply(PriceQuote quote) {
        PriceQuote previous = latest.get(quote.pair());
        PriceQuote stored = quote;
        if (previous != null && previous.timestamp() != null && quote.timestamp() != null
                && quote.timestamp().isBefore(previous.timestamp())) {
            stored = quote.withTimestamp(previous.timestamp());
        }
        latest.put(quote.pair(), stored);
        Deque<Double> series = history.computeIfAbsent(quote.pair(), p -> new ArrayDeque<>());
        series.addLast(quote.price().doubleValue());
        trim(series);
        return stored;
    }

    public List<Double> history(String pair) {
        Deque<Double> series = history.get(pair);
        return series == null ? List.of() : List.copyOf(series);
    }

    public Optional<PriceQuote> latest(String pair) {
        return Optional.ofNullable(latest.get(pair));
    }

    public Optional<BigDecimal> latestPrice(String pair) {
        return latest(pair).map(PriceQuote::price);
    }

    public Map<String, PriceQuote> quotes() {
        return new LinkedHashMap<>(latest);
    }

    public Map<String, BigDecimal> latestPrices() {
        Map<String, BigDecimal> prices = new HashMap<>();
        latest.forEach((pair, quote) -> prices.put(pair, quote.price()));
        return prices;
    }

    private void trim(Deque<Double> series) {
        while (series.size() > capacity) {
            series.removeFirst();
        }
    }
}
