package com.regwatch.core.events;

import java.time.Instant;

public record SourceCheckFailed(
        Instant timestamp,
        String sourceId,
        String displayName,
        String failureKind,
        String message
) implements Event {
    @Override
    public String type() {
        return "SourceCheckFailed";
    }
}
