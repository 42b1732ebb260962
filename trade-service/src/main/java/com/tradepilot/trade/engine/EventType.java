package com.tradepilot.trade.engine;

public enum EventType {
    INFO,
    SUCCESS,
    WARNING,
    ADVISORY
}
