package com.autods.core.memory;

import com.autods.core.model.MemoryRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the memory file: {@code {"datasets": {fp: record}, "notes": [...]}}.
 */
public record MemoryDocument(
    @JsonProperty("datasets") Map<String, MemoryRecord> datasets,
    @JsonProperty("notes") List<MemoryNote> notes
) {}
