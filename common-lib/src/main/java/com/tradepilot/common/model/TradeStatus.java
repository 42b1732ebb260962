package com.tradepilot.common.model;

/**
 * Trade lifecycle states. CLOSED is terminal.
 */
public enum TradeStatus {
    OPEN,
    CLOSED
}
