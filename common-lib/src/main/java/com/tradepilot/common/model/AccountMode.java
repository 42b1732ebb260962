package com.tradepilot.common.model;

/**
 * Account a trade is booked against. Each mode has its own balance and is fixed
 * on the trade at creation time.
 */
public enum AccountMode {
    TRIAL,
    LIVE
}
