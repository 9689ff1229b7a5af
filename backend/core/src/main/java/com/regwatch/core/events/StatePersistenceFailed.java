package com.regwatch.core.events;

import java.time.Instant;

public record StatePersistenceFailed(
        Instant timestamp,
        String operation,
        String path,
        String message
) implements Event {
    @Override
    public String type() {
        return "StatePersistenceFailed";
    }
}
