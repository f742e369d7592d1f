package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Verdict produced by a reflector for one iteration.
 */
public record Reflection(
    @JsonProperty("status") ReflectionStatus status,
    @JsonProperty("best_model") String bestModel,
    @JsonProperty("issues") List<String> issues,
    @JsonProperty("suggestions") List<String> suggestions,
    @JsonProperty("replan_recommended") boolean replanRecommended
) implements Serializable {

    public Reflection {
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }
}
