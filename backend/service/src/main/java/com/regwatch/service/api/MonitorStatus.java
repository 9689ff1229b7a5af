package com.regwatch.service.api;

import com.regwatch.core.model.Change;
import com.regwatch.core.model.LogEntry;
import com.regwatch.core.model.SweepRecord;

import java.time.Instant;
import java.util.List;

public record MonitorStatus(
        String status,
        boolean sweepInProgress,
        long totalChecks,
        long changesDetected,
        Instant lastCheck,
        Instant nextCheck,
        List<SourceStatus> sources,
        List<Change> recentChanges,
        List<LogEntry> recentLogs,
        List<SweepRecord> checkHistory,
        boolean hasNewChanges
) {
}
