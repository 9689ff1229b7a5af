package com.regwatch.core.events;

import java.time.Instant;

public record NotificationDelivered(
        Instant timestamp,
        int changeCount,
        int statusCode
) implements Event {
    @Override
    public String type() {
        return "NotificationDelivered";
    }
}
