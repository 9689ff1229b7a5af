package com.regwatch.collectors.api;

import com.regwatch.core.model.HistoryEntry;

import java.util.Optional;

/**
 * Per-source history as seen by the change detector. Implementations must keep at
 * most one entry per source id and replace it atomically.
 */
public interface HistoryLedger {
    Optional<HistoryEntry> findHistory(String sourceId);

    void putHistory(HistoryEntry entry);
}
