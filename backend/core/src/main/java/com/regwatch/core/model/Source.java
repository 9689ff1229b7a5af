package com.regwatch.core.model;

import java.util.Objects;

/**
 * One monitored page. The url is the identity of the source: history, changes and
 * status are all keyed by it.
 */
public record Source(
        String url,
        String displayName,
        SourceCategory category,
        Priority priority
) {
    public Source {
        Objects.requireNonNull(url, "url is required");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        Objects.requireNonNull(category, "category is required");
        displayName = displayName == null || displayName.isBlank() ? url : displayName;
        priority = priority == null ? Priority.lowest() : priority;
    }

    public String id() {
        return url;
    }
}
