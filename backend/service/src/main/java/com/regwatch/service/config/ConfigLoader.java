package com.regwatch.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.regwatch.core.model.SourceRegistry;
import com.regwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    static final String SOURCES_FILE = "sources.json";
    static final String DEFAULT_SOURCES_RESOURCE = "/default-sources.json";

    private ConfigLoader() {
    }

    /**
     * Reads {@code sources.json} from the config directory, falling back to the
     * bundled catalog when the file is absent.
     */
    public static SourceCatalog loadCatalog(Path configDir) {
        Path path = configDir.resolve(SOURCES_FILE);
        if (Files.exists(path)) {
            return validate(read(path, new TypeReference<SourceCatalog>() {
            }), path.toString());
        }
        return loadDefaultCatalog();
    }

    public static SourceCatalog loadDefaultCatalog() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULT_SOURCES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULT_SOURCES_RESOURCE);
            }
            return validate(JsonUtils.objectMapper().readValue(in, SourceCatalog.class), DEFAULT_SOURCES_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + DEFAULT_SOURCES_RESOURCE, e);
        }
    }

    public static SourceRegistry registry(SourceCatalog catalog) {
        return new SourceRegistry(catalog.sources());
    }

    private static SourceCatalog validate(SourceCatalog catalog, String origin) {
        if (catalog == null || catalog.sources() == null || catalog.sources().isEmpty()) {
            throw new IllegalStateException("No sources configured in " + origin);
        }
        try {
            new SourceRegistry(catalog.sources());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid source catalog in " + origin + ": " + e.getMessage(), e);
        }
        return catalog;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
