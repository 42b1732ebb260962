package com.tradepilot.common.model;

/**
 * Origin of an {@link Insight} or {@link PerformanceAudit}.
 *
 * <ul>
 *   <li>{@link #EXTERNAL}: produced by the advisory service</li>
 *   <li>{@link #FALLBACK}: produced locally after the advisory call failed, timed out or was malformed</li>
 * </ul>
 */
public enum Provenance {
    EXTERNAL,
    FALLBACK
}
