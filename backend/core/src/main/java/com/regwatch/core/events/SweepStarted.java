package com.regwatch.core.events;

import java.time.Instant;

public record SweepStarted(
        Instant timestamp,
        String trigger,
        int sourceCount
) implements Event {
    @Override
    public String type() {
        return "SweepStarted";
    }
}
