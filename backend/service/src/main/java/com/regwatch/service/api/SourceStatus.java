package com.regwatch.service.api;

import com.regwatch.core.model.CheckStatus;
import com.regwatch.core.model.Priority;
import com.regwatch.core.model.SourceCategory;

import java.time.Instant;

public record SourceStatus(
        String url,
        String name,
        SourceCategory category,
        Priority priority,
        CheckStatus status,
        Instant lastChecked,
        String lastError,
        Instant lastErrorAt
) {
}
