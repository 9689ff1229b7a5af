package com.regwatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regwatch.core.bus.EventBus;
import com.regwatch.core.events.StatePersistenceFailed;
import com.regwatch.core.model.MonitorSnapshot;
import com.regwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores the whole snapshot as one pretty-printed JSON document, rewritten on every
 * save through a sibling temp file.
 */
public class JsonFileHistoryStore implements HistoryStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileHistoryStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonFileHistoryStore(Path file, EventBus eventBus, Clock clock) {
        this.file = file;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public MonitorSnapshot load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                LOGGER.info("No state file at " + file + "; starting with empty state");
                return MonitorSnapshot.empty();
            }
            try (InputStream in = Files.newInputStream(file)) {
                MonitorSnapshot loaded = MAPPER.readValue(in, MonitorSnapshot.class);
                return loaded == null ? MonitorSnapshot.empty() : loaded;
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.INFO, "Unreadable state file " + file + "; starting with empty state", e);
            return MonitorSnapshot.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveCurrent(Supplier<MonitorSnapshot> current) {
        lock.lock();
        try {
            save(current.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(MonitorSnapshot snapshot) {
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
            replace(temp);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed writing state to " + file, e);
            eventBus.publish(new StatePersistenceFailed(
                    clock.instant(),
                    "save",
                    file.toString(),
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()
            ));
        } finally {
            lock.unlock();
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
