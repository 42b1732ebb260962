package com.tradepilot.trade.marketdata;

import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.common.money.MoneyUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Stand-in for the exchange when it cannot be reached: each pair moves by a
 * uniform step of at most half its {@link AssetProfile#walkStep()}, never below
 * {@link #MIN_PRICE}. The 24h change is carried over unchanged.
 */
@Component
public class SyntheticPriceWalk {

    static final BigDecimal MIN_PRICE = new BigDecimal("0.01");

    private final Random random;
    private final Clock clock;

    @Autowired
    public SyntheticPriceWalk(Clock clock) {
        this(new Random(), clock);
    }

    public SyntheticPriceWalk(Random random, Clock clock) {
        this.random = random;
        this.clock  = clock;
    }

    public MarketSnapshot step(List<String> pairs, Map<String, PriceQuote> current) {
        Map<String, PriceQuote> next = new HashMap<>();
        for (String pair : pairs) {
            AssetProfile profile = AssetProfile.forPair(pair);
            PriceQuote previous = current.get(pair);
            BigDecimal base   = previous != null ? previous.price() : profile.defaultPrice();
            double change     = previous != null ? previous.pctChange24h() : profile.defaultChangePct();
            double movement   = (random.nextDouble() - 0.5) * profile.walkStep();
            BigDecimal moved  = MoneyUtils.scale(base.add(BigDecimal.valueOf(movement)));
            next.put(pair, new PriceQuote(pair, moved.max(MIN_PRICE), change, clock.instant()));
        }
        // simulated round trip in [15, 44] ms
        return new MarketSnapshot(Map.copyOf(next), 15 + random.nextInt(30), true);
    }
}
