package com.regwatch.service.log;

import com.regwatch.core.model.LogEntry;
import com.regwatch.core.model.Severity;
import com.regwatch.service.state.MonitorState;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operational journal shown on the status surface. Entries land in the bounded log
 * ring of {@link MonitorState} and are mirrored to java.util.logging.
 */
public class EventLog {
    private static final Logger LOGGER = Logger.getLogger(EventLog.class.getName());

    private final MonitorState state;
    private final Clock clock;

    public EventLog(MonitorState state, Clock clock) {
        this.state = state;
        this.clock = clock;
    }

    public void append(Severity severity, String message) {
        state.appendLog(new LogEntry(clock.instant(), severity, message));
        LOGGER.log(levelFor(severity), message);
    }

    public void info(String message) {
        append(Severity.INFO, message);
    }

    public void success(String message) {
        append(Severity.SUCCESS, message);
    }

    public void warning(String message) {
        append(Severity.WARNING, message);
    }

    public void error(String message) {
        append(Severity.ERROR, message);
    }

    static Level levelFor(Severity severity) {
        switch (severity) {
            case WARNING:
                return Level.WARNING;
            case ERROR:
                return Level.SEVERE;
            default:
                return Level.INFO;
        }
    }
}
