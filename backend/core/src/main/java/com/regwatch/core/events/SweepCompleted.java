package com.regwatch.core.events;

import java.time.Instant;

public record SweepCompleted(
        Instant timestamp,
        int sourcesChecked,
        int changesFound,
        int sourcesFailed,
        long durationMillis,
        boolean interrupted
) implements Event {
    @Override
    public String type() {
        return "SweepCompleted";
    }
}
