package com.tradepilot.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Recommendation produced by trend analysis or the advisory service.
 */
public enum SignalAction {

    BUY,
    SELL,
    HOLD;

    /**
     * Lenient parse of an advisory action string. Returns empty for null, blank
     * or unrecognised values so callers can treat them as malformed.
     */
    public static Optional<SignalAction> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(SignalAction.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
