package com.regwatch.core.events;

import java.time.Instant;

public record SourceChecked(
        Instant timestamp,
        String sourceId,
        String displayName,
        String outcome,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceChecked";
    }
}
