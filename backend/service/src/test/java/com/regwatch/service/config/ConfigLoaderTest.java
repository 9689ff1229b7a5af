package com.regwatch.service.config;

import com.regwatch.core.model.Priority;
import com.regwatch.core.model.SourceCategory;
import com.regwatch.core.model.SourceRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void fallsBackToBundledCatalogWhenDirectoryHasNoSourcesFile() throws Exception {
        Path dir = Files.createTempDirectory("config-empty-");

        SourceCatalog catalog = ConfigLoader.loadCatalog(dir);
        SourceRegistry registry = ConfigLoader.registry(catalog);

        assertEquals("EUDR/FSC", catalog.label());
        assertEquals(10, registry.size());
        assertEquals(6, registry.countByCategory().get(SourceCategory.EUDR));
        assertEquals(4, registry.countByCategory().get(SourceCategory.FSC));
        assertTrue(registry.sources().stream().anyMatch(source -> source.priority() == Priority.CRITICAL));
    }

    @Test
    void readsSourcesFileAndDefaultsMissingFields() throws Exception {
        Path dir = Files.createTempDirectory("config-file-");
        Files.writeString(dir.resolve("sources.json"), """
                {
                  "label": "Timber",
                  "sources": [
                    {"url": "https://example.org/a", "displayName": "A", "category": "FSC", "priority": "critical"},
                    {"url": "https://example.org/b", "category": "EUDR"}
                  ]
                }
                """);

        SourceCatalog catalog = ConfigLoader.loadCatalog(dir);

        assertEquals("Timber", catalog.label());
        assertEquals(2, catalog.sources().size());
        assertEquals(Priority.CRITICAL, catalog.sources().get(0).priority());
        assertEquals(Priority.MEDIUM, catalog.sources().get(1).priority());
        assertEquals("https://example.org/b", catalog.sources().get(1).displayName());
    }

    @Test
    void duplicateUrlsFailStartup() throws Exception {
        Path dir = Files.createTempDirectory("config-dup-");
        Files.writeString(dir.resolve("sources.json"), """
                {"sources": [
                  {"url": "https://example.org/a", "category": "FSC"},
                  {"url": "https://example.org/a", "category": "EUDR"}
                ]}
                """);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadCatalog(dir));
        assertTrue(ex.getMessage().contains("Invalid source catalog"));
        assertTrue(ex.getMessage().contains("https://example.org/a"));
    }

    @Test
    void emptyCatalogFailsStartup() throws Exception {
        Path dir = Files.createTempDirectory("config-none-");
        Files.writeString(dir.resolve("sources.json"), "{\"sources\": []}");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadCatalog(dir));
        assertTrue(ex.getMessage().contains("No sources configured"));
    }

    @Test
    void malformedFileFailsWithPath() throws Exception {
        Path dir = Files.createTempDirectory("config-bad-");
        Files.writeString(dir.resolve("sources.json"), "{not json");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadCatalog(dir));
        assertTrue(ex.getMessage().startsWith("Failed loading config from"));
    }
}
