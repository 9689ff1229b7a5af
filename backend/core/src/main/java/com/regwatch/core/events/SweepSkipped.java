package com.regwatch.core.events;

import java.time.Instant;

public record SweepSkipped(
        Instant timestamp,
        String trigger,
        String reason
) implements Event {
    @Override
    public String type() {
        return "SweepSkipped";
    }
}
