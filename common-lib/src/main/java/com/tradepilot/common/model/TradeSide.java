package com.tradepilot.common.model;

/**
 * Direction of a position. BUY is long, SELL is short.
 */
public enum TradeSide {

    BUY,
    SELL;

    /** +1 for long positions, -1 for short positions. */
    public int sign() {
        return switch (this) {
            case BUY  -> 1;
            case SELL -> -1;
        };
    }
}
