package com.regwatch.core.events;

import com.regwatch.core.model.Priority;
import com.regwatch.core.model.SourceCategory;

import java.time.Instant;

public record ChangeDetected(
        Instant timestamp,
        String sourceId,
        String displayName,
        SourceCategory category,
        Priority priority,
        String oldDigest,
        String newDigest
) implements Event {
    @Override
    public String type() {
        return "ChangeDetected";
    }
}
