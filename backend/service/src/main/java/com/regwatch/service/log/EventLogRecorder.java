package com.regwatch.service.log;

import com.regwatch.core.bus.EventBus;
import com.regwatch.core.events.ChangeDetected;
import com.regwatch.core.events.NotificationDelivered;
import com.regwatch.core.events.NotificationFailed;
import com.regwatch.core.events.SourceCheckFailed;
import com.regwatch.core.events.SourceChecked;
import com.regwatch.core.events.StatePersistenceFailed;
import com.regwatch.core.events.SweepCompleted;
import com.regwatch.core.events.SweepSkipped;
import com.regwatch.core.events.SweepStarted;

/**
 * Translates engine events into event log entries.
 */
public final class EventLogRecorder {
    private final EventLog eventLog;

    private EventLogRecorder(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public static EventLogRecorder attach(EventBus eventBus, EventLog eventLog) {
        EventLogRecorder recorder = new EventLogRecorder(eventLog);
        eventBus.subscribe(SweepStarted.class, recorder::onSweepStarted);
        eventBus.subscribe(SourceChecked.class, recorder::onSourceChecked);
        eventBus.subscribe(SourceCheckFailed.class, recorder::onSourceCheckFailed);
        eventBus.subscribe(ChangeDetected.class, recorder::onChangeDetected);
        eventBus.subscribe(SweepCompleted.class, recorder::onSweepCompleted);
        eventBus.subscribe(SweepSkipped.class, recorder::onSweepSkipped);
        eventBus.subscribe(NotificationDelivered.class, recorder::onNotificationDelivered);
        eventBus.subscribe(NotificationFailed.class, recorder::onNotificationFailed);
        eventBus.subscribe(StatePersistenceFailed.class, recorder::onPersistenceFailed);
        return recorder;
    }

    private void onSweepStarted(SweepStarted event) {
        eventLog.info("Starting " + event.trigger() + " check of " + event.sourceCount() + " sources");
    }

    private void onSourceChecked(SourceChecked event) {
        eventLog.info("Checked: " + event.displayName() + " (" + event.outcome() + ")");
    }

    private void onSourceCheckFailed(SourceCheckFailed event) {
        eventLog.error("Error: " + event.displayName() + " - " + event.message());
    }

    private void onChangeDetected(ChangeDetected event) {
        eventLog.warning("CHANGE DETECTED: " + event.displayName());
    }

    private void onSweepCompleted(SweepCompleted event) {
        String suffix = event.sourcesFailed() > 0 ? ", " + event.sourcesFailed() + " source(s) failed" : "";
        if (event.interrupted()) {
            eventLog.warning("Check stopped early after " + event.sourcesChecked() + " sources" + suffix);
        } else if (event.changesFound() > 0) {
            eventLog.warning("Check completed - " + event.changesFound() + " CHANGE(S) FOUND" + suffix);
        } else {
            eventLog.success("Check completed - all sources unchanged" + suffix);
        }
    }

    private void onSweepSkipped(SweepSkipped event) {
        eventLog.info("Skipped " + event.trigger() + " check: " + event.reason());
    }

    private void onNotificationDelivered(NotificationDelivered event) {
        eventLog.success("Notification sent for " + event.changeCount() + " change(s)");
    }

    private void onNotificationFailed(NotificationFailed event) {
        eventLog.error("Notification failed: " + event.reason());
    }

    private void onPersistenceFailed(StatePersistenceFailed event) {
        eventLog.error("Could not " + event.operation() + " state at " + event.path() + ": " + event.message());
    }
}
