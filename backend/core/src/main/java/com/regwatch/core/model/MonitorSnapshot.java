package com.regwatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the monitor state. This is both what gets persisted and what the
 * status readers see. Lists are ordered newest first.
 */
public record MonitorSnapshot(
        long totalSweeps,
        long totalChangesDetected,
        Instant lastSweepAt,
        Instant nextSweepAt,
        Map<String, HistoryEntry> history,
        List<Change> changes,
        List<SweepRecord> sweeps,
        List<LogEntry> logs
) {
    public MonitorSnapshot {
        history = history == null ? Map.of() : Map.copyOf(history);
        changes = changes == null ? List.of() : List.copyOf(changes);
        sweeps = sweeps == null ? List.of() : List.copyOf(sweeps);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static MonitorSnapshot empty() {
        return new MonitorSnapshot(0, 0, null, null, Map.of(), List.of(), List.of(), List.of());
    }

    public boolean hasUnacknowledgedChanges() {
        return changes.stream().anyMatch(change -> !change.acknowledged());
    }
}
