package com.autods.core.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the memory note log.
 */
public record MemoryNote(
    @JsonProperty("ts") String ts,
    @JsonProperty("msg") String msg
) {}
