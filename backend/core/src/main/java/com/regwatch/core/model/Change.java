package com.regwatch.core.model;

import java.time.Instant;

public record Change(
        String sourceId,
        String displayName,
        SourceCategory category,
        Priority priority,
        Instant detectedAt,
        Instant previousCheckedAt,
        String previousDigest,
        String newDigest,
        boolean acknowledged
) {
    public static Change detected(Source source, HistoryEntry previous, String newDigest, Instant detectedAt) {
        return new Change(
                source.id(),
                source.displayName(),
                source.category(),
                source.priority(),
                detectedAt,
                previous.lastCheckedAt(),
                previous.lastDigest(),
                newDigest,
                false
        );
    }

    public Change acknowledge() {
        if (acknowledged) {
            return this;
        }
        return new Change(
                sourceId,
                displayName,
                category,
                priority,
                detectedAt,
                previousCheckedAt,
                previousDigest,
                newDigest,
                true
        );
    }
}
