package com.regwatch.core.model;

import java.time.Instant;

/**
 * Last known state of one source. {@code lastDigest} stays null until the first
 * successful fetch; {@code lastCheckedAt} is the time of the last successful check.
 */
public record HistoryEntry(
        String sourceId,
        String displayName,
        SourceCategory category,
        String lastDigest,
        Instant lastCheckedAt,
        CheckStatus lastStatus,
        String lastError,
        Instant lastErrorAt
) {
    public static HistoryEntry checked(Source source, String digest, Instant checkedAt) {
        return new HistoryEntry(
                source.id(),
                source.displayName(),
                source.category(),
                digest,
                checkedAt,
                CheckStatus.CHECKED,
                null,
                null
        );
    }

    public HistoryEntry withError(String message, Instant failedAt) {
        return new HistoryEntry(
                sourceId,
                displayName,
                category,
                lastDigest,
                lastCheckedAt,
                CheckStatus.ERROR,
                message,
                failedAt
        );
    }

    public boolean hasBaseline() {
        return lastDigest != null;
    }
}
