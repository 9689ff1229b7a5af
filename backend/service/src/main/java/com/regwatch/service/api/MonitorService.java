package com.regwatch.service.api;

import com.regwatch.core.model.CheckStatus;
import com.regwatch.core.model.HistoryEntry;
import com.regwatch.core.model.MonitorSnapshot;
import com.regwatch.core.model.Source;
import com.regwatch.core.model.SourceRegistry;
import com.regwatch.service.log.EventLog;
import com.regwatch.service.runtime.CheckRequest;
import com.regwatch.service.runtime.SweepScheduler;
import com.regwatch.service.state.MonitorState;
import com.regwatch.service.store.HistoryStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations the HTTP surface exposes over the monitor core.
 */
public class MonitorService {
    static final int RECENT_CHANGES = 20;
    static final int RECENT_LOGS = 25;
    static final int RECENT_SWEEPS = 24;

    private final SourceRegistry registry;
    private final MonitorState state;
    private final SweepScheduler scheduler;
    private final HistoryStore store;
    private final EventLog eventLog;

    public MonitorService(
            SourceRegistry registry,
            MonitorState state,
            SweepScheduler scheduler,
            HistoryStore store,
            EventLog eventLog
    ) {
        this.registry = registry;
        this.state = state;
        this.scheduler = scheduler;
        this.store = store;
        this.eventLog = eventLog;
    }

    /**
     * Consistent read of the current state. A sweep in flight may already have
     * refreshed some sources and not others.
     */
    public MonitorStatus status() {
        MonitorSnapshot snapshot = state.snapshot();
        List<SourceStatus> sources = new ArrayList<>(registry.size());
        for (Source source : registry.sources()) {
            HistoryEntry entry = snapshot.history().get(source.id());
            sources.add(new SourceStatus(
                    source.url(),
                    source.displayName(),
                    source.category(),
                    source.priority(),
                    entry == null || entry.lastStatus() == null ? CheckStatus.UNKNOWN : entry.lastStatus(),
                    entry == null ? null : entry.lastCheckedAt(),
                    entry == null ? null : entry.lastError(),
                    entry == null ? null : entry.lastErrorAt()
            ));
        }
        return new MonitorStatus(
                "running",
                scheduler.isRunning(),
                snapshot.totalSweeps(),
                snapshot.totalChangesDetected(),
                snapshot.lastSweepAt(),
                snapshot.nextSweepAt(),
                sources,
                head(snapshot.changes(), RECENT_CHANGES),
                head(snapshot.logs(), RECENT_LOGS),
                head(snapshot.sweeps(), RECENT_SWEEPS),
                snapshot.hasUnacknowledgedChanges()
        );
    }

    public CheckRequest requestCheck() {
        CheckRequest result = scheduler.requestCheck();
        if (result == CheckRequest.ACCEPTED) {
            eventLog.info("Manual check requested");
        }
        return result;
    }

    public int markAllRead() {
        int acknowledged = state.acknowledgeAll();
        store.saveCurrent(state::snapshot);
        return acknowledged;
    }

    private static <T> List<T> head(List<T> items, int limit) {
        return items.size() <= limit ? items : List.copyOf(items.subList(0, limit));
    }
}
