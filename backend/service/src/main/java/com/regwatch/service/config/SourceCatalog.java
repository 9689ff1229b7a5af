package com.regwatch.service.config;

import com.regwatch.core.model.Source;

import java.util.List;

public record SourceCatalog(String label, List<Source> sources) {
}
