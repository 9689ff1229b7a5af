package com.regwatch.service.store;

import com.regwatch.core.model.MonitorSnapshot;

import java.util.function.Supplier;

/**
 * Durable home of the monitor snapshot. Both operations are best effort: neither
 * throws, a failed load yields an empty snapshot and a failed save leaves the
 * in-memory state authoritative.
 */
public interface HistoryStore {
    MonitorSnapshot load();

    void save(MonitorSnapshot snapshot);

    /**
     * Saves the snapshot produced by {@code current}. Implementations that can be
     * written from several threads take the snapshot inside their write critical
     * section, so an older snapshot never lands after a newer one.
     */
    default void saveCurrent(Supplier<MonitorSnapshot> current) {
        save(current.get());
    }
}
