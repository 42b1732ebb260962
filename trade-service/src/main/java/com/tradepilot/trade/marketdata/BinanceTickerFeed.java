package com.tradepilot.trade.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.common.exception.EngineException;
import com.tradepilot.common.model.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Polls the public 24h ticker endpoint, one request per pair.
 *
 * <p>{@code BTC/USDT} is requested as symbol {@code BTCUSDT}. A failure or an
 * unusable price for any pair fails the whole poll.
 */
@Component
public class BinanceTickerFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(BinanceTickerFeed.class);
    private static final String TICKER_PATH = "/api/v3/ticker/24hr?symbol=";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String baseUrl;

    public BinanceTickerFeed(@Qualifier("marketDataWebClient") WebClient webClient, ObjectMapper objectMapper,
                             Clock clock, @Value("${market-data.base-url:https://api.binance.com}") String baseUrl) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.baseUrl      = baseUrl;
    }

    @Override
    public Mono<MarketSnapshot> poll(List<String> pairs, String proxyPrefix) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return Flux.fromIterable(pairs)
                .flatMap(pair -> fetch(pair, proxyPrefix))
                .collectMap(PriceQuote::pair)
                .map(quotes -> new MarketSnapshot(Map.copyOf(quotes),
                                                  (System.nanoTime() - started) / 1_000_000, false));
        });
    }

    private Mono<PriceQuote> fetch(String pair, String proxyPrefix) {
        String url = (proxyPrefix == null ? "" : proxyPrefix) + baseUrl + TICKER_PATH + toSymbol(pair);
        return webClient.get()
            .uri(url)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parse(pair, body))
            .doOnError(e -> log.debug("[MarketFeed] Ticker request failed. pair={} reason={}", pair, e.getMessage()));
    }

    PriceQuote parse(String pair, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new EngineException("MarketFeed", "unreadable ticker response for " + pair, e);
        }
        String lastPrice = root.path("lastPrice").asText("");
        if (lastPrice.isBlank()) {
            throw new EngineException("MarketFeed", "ticker response for " + pair + " has no lastPrice");
        }
        BigDecimal price;
        try {
            price = new BigDecimal(lastPrice);
        } catch (NumberFormatException e) {
            throw new EngineException("MarketFeed", "invalid lastPrice for " + pair + ": " + lastPrice, e);
        }
        if (price.signum() <= 0) {
            throw new EngineException("MarketFeed", "non-positive lastPrice for " + pair + ": " + lastPrice);
        }
        double change = root.path("priceChangePercent").asDouble(0.0);
        return new PriceQuote(pair, price, Double.isFinite(change) ? change : 0.0, clock.instant());
    }

    static String toSymbol(String pair) {
        return pair.replace("/", "").toUpperCase();
    }
}
