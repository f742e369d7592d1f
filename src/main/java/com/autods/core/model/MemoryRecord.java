package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Best known outcome for one dataset fingerprint.
 */
public record MemoryRecord(
    @JsonProperty("last_seen") String lastSeen,
    @JsonProperty("target") String target,
    @JsonProperty("shape") DatasetShape shape,
    @JsonProperty("best_model") String bestModel,
    @JsonProperty("best_metrics") ModelMetrics bestMetrics
) implements Serializable {}
