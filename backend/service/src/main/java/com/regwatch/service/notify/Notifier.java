package com.regwatch.service.notify;

import com.regwatch.core.model.Change;

import java.util.List;

/**
 * Outbound alert channel. One call per sweep carries the whole batch of changes.
 * Implementations swallow delivery failures.
 */
public interface Notifier {
    void notifyChanges(List<Change> changes);

    default boolean enabled() {
        return true;
    }

    static Notifier disabled() {
        return new Notifier() {
            @Override
            public void notifyChanges(List<Change> changes) {
            }

            @Override
            public boolean enabled() {
                return false;
            }
        };
    }
}
