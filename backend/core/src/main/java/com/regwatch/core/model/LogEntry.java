package com.regwatch.core.model;

import java.time.Instant;

public record LogEntry(
        Instant timestamp,
        Severity severity,
        String message
) {
}
