package com.regwatch.core.model;

import java.time.Instant;

public record SweepRecord(
        Instant timestamp,
        int sourcesChecked,
        int changesFound,
        int sourcesFailed,
        long durationMillis
) {
}
