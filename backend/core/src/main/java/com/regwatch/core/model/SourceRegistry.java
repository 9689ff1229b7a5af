package com.regwatch.core.model;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed catalog of monitored sources. Iteration order is the declaration order and
 * is the order in which a sweep visits the sources.
 */
public final class SourceRegistry {
    private final List<Source> sources;

    public SourceRegistry(List<Source> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source is required");
        }
        Set<String> ids = new HashSet<>();
        for (Source source : sources) {
            if (!ids.add(source.id())) {
                throw new IllegalArgumentException("Duplicate source url: " + source.id());
            }
        }
        this.sources = List.copyOf(sources);
    }

    public List<Source> sources() {
        return sources;
    }

    public int size() {
        return sources.size();
    }

    public Map<SourceCategory, Integer> countByCategory() {
        Map<SourceCategory, Integer> counts = new EnumMap<>(SourceCategory.class);
        for (Source source : sources) {
            counts.merge(source.category(), 1, Integer::sum);
        }
        return counts;
    }
}
