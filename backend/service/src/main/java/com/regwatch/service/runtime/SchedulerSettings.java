package com.regwatch.service.runtime;

import java.time.Duration;
import java.util.Objects;

public record SchedulerSettings(
        Duration interval,
        Duration spacing,
        Duration initialDelay,
        Duration shutdownGrace
) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
    public static final Duration DEFAULT_SPACING = Duration.ofSeconds(2);
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);

    public SchedulerSettings {
        Objects.requireNonNull(interval, "interval is required");
        Objects.requireNonNull(spacing, "spacing is required");
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace is required");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (spacing.isNegative() || initialDelay.isNegative() || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("spacing, initialDelay and shutdownGrace must not be negative");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_INTERVAL, DEFAULT_SPACING, DEFAULT_INITIAL_DELAY, DEFAULT_SHUTDOWN_GRACE);
    }
}
