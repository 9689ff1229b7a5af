package com.regwatch.core.events;

import java.time.Instant;

public record NotificationFailed(
        Instant timestamp,
        int changeCount,
        String reason
) implements Event {
    @Override
    public String type() {
        return "NotificationFailed";
    }
}
