package com.tradepilot.trade.marketdata;

import java.math.BigDecimal;

/**
 * Per-asset constants used where no live data exists: history seeding, default
 * quotes, synthetic walk step and the advisory fallback's level band.
 */
public enum AssetProfile {

    BTC(96_000.0, 200.0, 15.0, new BigDecimal("96450.00"), 1.20, 50.0, 0.02, 96_500.0),
    ETH(2_600.0, 10.0, 3.0, new BigDecimal("2680.00"), 0.45, 5.0, 0.04, 2_650.0),
    OTHER(190.0, 5.0, 0.8, new BigDecimal("198.50"), -0.15, 5.0, 0.04, 198.0);

    private final double seedBase;
    private final double seedAmplitude;
    private final double seedDrift;
    private final BigDecimal defaultPrice;
    private final double defaultChangePct;
    private final double walkStep;
    private final double volatility;
    private final double referencePrice;

    AssetProfile(double seedBase, double seedAmplitude, double seedDrift, BigDecimal defaultPrice,
                 double defaultChangePct, double walkStep, double volatility, double referencePrice) {
        this.seedBase         = seedBase;
        this.seedAmplitude    = seedAmplitude;
        this.seedDrift        = seedDrift;
        this.defaultPrice     = defaultPrice;
        this.defaultChangePct = defaultChangePct;
        this.walkStep         = walkStep;
        this.volatility       = volatility;
        this.referencePrice   = referencePrice;
    }

    public static AssetProfile forPair(String pair) {
        if (pair == null) {
            return OTHER;
        }
        String upper = pair.toUpperCase();
        if (upper.startsWith("BTC")) return BTC;
        if (upper.startsWith("ETH")) return ETH;
        return OTHER;
    }

    /** Seed point {@code i} of the synthetic warm-up series. */
    public double seedPrice(int i) {
        return seedBase + Math.sin(i / 10.0) * seedAmplitude + i * seedDrift;
    }

    public BigDecimal defaultPrice()    { return defaultPrice; }
    public double defaultChangePct()    { return defaultChangePct; }

    /** Width of one synthetic walk step; moves are uniform in ±walkStep/2. */
    public double walkStep()            { return walkStep; }

    /** Half-width of the fallback support/resistance band, as a fraction of price. */
    public double volatility()          { return volatility; }

    /** Price assumed by the advisory fallback when no quote is known. */
    public double referencePrice()      { return referencePrice; }
}
