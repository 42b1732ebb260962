package com.tradepilot.common.exception;

/**
 * Raised when a command is refused by validation: a non-positive trade amount,
 * a missing price, or an invalid risk configuration. State is left unchanged.
 */
public class TradeRejectedException extends EngineException {

    public TradeRejectedException(String component, String message) {
        super(component, message);
    }
}
