package com.regwatch.service.state;

import com.regwatch.collectors.api.HistoryLedger;
import com.regwatch.core.model.Change;
import com.regwatch.core.model.HistoryEntry;
import com.regwatch.core.model.LogEntry;
import com.regwatch.core.model.MonitorSnapshot;
import com.regwatch.core.model.SweepRecord;
import com.regwatch.core.util.BoundedRing;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide monitor state. Every mutation takes the write lock and every read
 * returns a copy taken under the read lock, so readers never see a half-written
 * history entry or counter pair.
 */
public class MonitorState implements HistoryLedger {
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();

    private final Map<String, HistoryEntry> history;
    private final BoundedRing<Change> changes;
    private final BoundedRing<SweepRecord> sweeps;
    private final BoundedRing<LogEntry> logs;
    private long totalSweeps;
    private long totalChangesDetected;
    private Instant lastSweepAt;
    private Instant nextSweepAt;

    private MonitorState(MonitorSnapshot snapshot, MonitorLimits limits) {
        this.history = new LinkedHashMap<>(snapshot.history());
        this.changes = BoundedRing.ofNewestFirst(limits.changeCapacity(), snapshot.changes());
        this.sweeps = BoundedRing.ofNewestFirst(limits.sweepCapacity(), snapshot.sweeps());
        this.logs = BoundedRing.ofNewestFirst(limits.logCapacity(), snapshot.logs());
        this.totalSweeps = snapshot.totalSweeps();
        this.totalChangesDetected = snapshot.totalChangesDetected();
        this.lastSweepAt = snapshot.lastSweepAt();
        this.nextSweepAt = snapshot.nextSweepAt();
    }

    public static MonitorState empty(MonitorLimits limits) {
        return new MonitorState(MonitorSnapshot.empty(), limits);
    }

    public static MonitorState restore(MonitorSnapshot snapshot, MonitorLimits limits) {
        return new MonitorState(snapshot, limits);
    }

    @Override
    public Optional<HistoryEntry> findHistory(String sourceId) {
        readLock.lock();
        try {
            return Optional.ofNullable(history.get(sourceId));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void putHistory(HistoryEntry entry) {
        writeLock.lock();
        try {
            history.put(entry.sourceId(), entry);
        } finally {
            writeLock.unlock();
        }
    }

    public void recordChange(Change change) {
        writeLock.lock();
        try {
            changes.push(change);
            totalChangesDetected++;
        } finally {
            writeLock.unlock();
        }
    }

    public void appendLog(LogEntry entry) {
        writeLock.lock();
        try {
            logs.push(entry);
        } finally {
            writeLock.unlock();
        }
    }

    public void completeSweep(SweepRecord record, Instant nextSweepAt) {
        writeLock.lock();
        try {
            sweeps.push(record);
            totalSweeps++;
            lastSweepAt = record.timestamp();
            this.nextSweepAt = nextSweepAt;
        } finally {
            writeLock.unlock();
        }
    }

    public void scheduleNextSweep(Instant nextSweepAt) {
        writeLock.lock();
        try {
            this.nextSweepAt = nextSweepAt;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return number of changes that were unacknowledged before the call
     */
    public int acknowledgeAll() {
        writeLock.lock();
        try {
            int[] flipped = {0};
            changes.replaceAll(change -> {
                if (!change.acknowledged()) {
                    flipped[0]++;
                }
                return change.acknowledge();
            });
            return flipped[0];
        } finally {
            writeLock.unlock();
        }
    }

    public MonitorSnapshot snapshot() {
        readLock.lock();
        try {
            return new MonitorSnapshot(
                    totalSweeps,
                    totalChangesDetected,
                    lastSweepAt,
                    nextSweepAt,
                    new HashMap<>(history),
                    changes.newestFirst(),
                    sweeps.newestFirst(),
                    logs.newestFirst()
            );
        } finally {
            readLock.unlock();
        }
    }
}
