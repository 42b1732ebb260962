package com.tradepilot.trade.persistence;

/**
 * Durable storage for engine state. {@link #load()} never fails: missing or
 * unreadable data is replaced by defaults.
 */
public interface PersistenceStore {

    EngineSnapshot load();

    void save(EngineSnapshot snapshot);
}
