package com.autods.core.memory;

import com.autods.core.config.JsonSupport;
import com.autods.core.error.StorageException;
import com.autods.core.model.MemoryRecord;
import com.autods.core.model.Timestamps;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MemoryStore} backed by a single JSON file, rewritten wholesale on every mutation.
 * <p>
 * The file is read once, at construction. Unreadable or malformed content does not
 * fail construction: the file is copied to {@code <path>.bak}, the store starts
 * empty, and a note records where the backup went.
 */
public class JsonMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonMemoryStore.class);

    private final Path path;
    private final ObjectMapper objectMapper = JsonSupport.mapper();
    private final Map<String, MemoryRecord> datasets = new LinkedHashMap<>();
    private final List<MemoryNote> notes = new ArrayList<>();

    public JsonMemoryStore(Path path) {
        this.path = path;
        load();
    }

    public Path path() {
        return path;
    }

    @Override
    public Optional<MemoryRecord> get(String fingerprint) {
        return Optional.ofNullable(datasets.get(fingerprint));
    }

    @Override
    public void upsert(String fingerprint, MemoryRecord record) {
        datasets.put(fingerprint, record);
        save();
    }

    @Override
    public void addNote(String message) {
        notes.add(new MemoryNote(Timestamps.nowIso(), message));
        save();
    }

    @Override
    public Map<String, MemoryRecord> records() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    @Override
    public List<MemoryNote> notes() {
        return List.copyOf(notes);
    }

    /**
     * Writes the whole store to disk.
     *
     * @throws StorageException if the file cannot be written
     */
    public void save() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), new MemoryDocument(datasets, notes));
        } catch (IOException e) {
            throw new StorageException("Cannot write memory file " + path, e);
        }
    }

    private void load() {
        if (!Files.exists(path)) {
            log.debug("Memory file {} does not exist yet; starting empty", path);
            return;
        }
        try {
            MemoryDocument document = objectMapper.readValue(path.toFile(), MemoryDocument.class);
            if (document == null) {
                throw new IOException("Memory file is empty");
            }
            if (document.datasets() != null) {
                for (Map.Entry<String, MemoryRecord> entry : document.datasets().entrySet()) {
                    if (!isComplete(entry.getValue())) {
                        throw new IOException("Malformed memory record for " + entry.getKey());
                    }
                    datasets.put(entry.getKey(), entry.getValue());
                }
            }
            if (document.notes() != null) {
                notes.addAll(document.notes());
            }
            log.info("Loaded memory from {} ({} datasets, {} notes)", path, datasets.size(), notes.size());
        } catch (IOException | RuntimeException e) {
            reset(e);
        }
    }

    private static boolean isComplete(MemoryRecord record) {
        return record != null
                && record.lastSeen() != null
                && record.target() != null
                && record.shape() != null
                && record.bestModel() != null
                && record.bestMetrics() != null;
    }

    private void reset(Exception cause) {
        datasets.clear();
        notes.clear();
        Path backup = path.resolveSibling(path.getFileName() + ".bak");
        String message;
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            message = "Memory reset; backup at " + backup;
        } catch (IOException copyFailure) {
            log.warn("Could not back up unreadable memory file {}: {}", path, copyFailure.getMessage());
            message = "Memory reset; backup to " + backup + " failed: " + copyFailure.getMessage();
        }
        log.warn("Memory file {} is unreadable ({}); starting with an empty store", path, cause.getMessage());
        notes.add(new MemoryNote(Timestamps.nowIso(), message));
    }
}
