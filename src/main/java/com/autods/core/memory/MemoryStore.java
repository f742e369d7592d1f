package com.autods.core.memory;

import com.autods.core.model.MemoryRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable map from dataset fingerprint to the best known outcome for that dataset,
 * plus an append-only note log.
 * <p>
 * Every mutation is persisted before the call returns. Implementations are
 * single-writer: two processes sharing one store lose updates (last write wins).
 */
public interface MemoryStore {

    /**
     * Looks up the record for a fingerprint. A fingerprint never seen before is not an error.
     */
    Optional<MemoryRecord> get(String fingerprint);

    /**
     * Inserts or replaces the record for a fingerprint and persists the store.
     */
    void upsert(String fingerprint, MemoryRecord record);

    /**
     * Appends a timestamped note and persists the store.
     */
    void addNote(String message);

    /** Snapshot of all records, in insertion order. */
    Map<String, MemoryRecord> records();

    /** Snapshot of the note log, oldest first. */
    List<MemoryNote> notes();
}
