package com.regwatch.service.runtime;

import java.time.Duration;

/**
 * Waits between two outbound fetches of a sweep.
 */
@FunctionalInterface
public interface Pacer {
    void pause(Duration spacing) throws InterruptedException;

    static Pacer sleeping() {
        return spacing -> {
            if (!spacing.isZero() && !spacing.isNegative()) {
                Thread.sleep(spacing.toMillis());
            }
        };
    }
}
