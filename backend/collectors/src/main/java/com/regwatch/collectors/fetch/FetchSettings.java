package com.regwatch.collectors.fetch;

import java.time.Duration;
import java.util.Objects;

public record FetchSettings(Duration requestTimeout, String userAgent) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    public FetchSettings {
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static FetchSettings defaults() {
        return new FetchSettings(DEFAULT_TIMEOUT, DEFAULT_USER_AGENT);
    }
}
