package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of a reflection pass.
 */
public enum ReflectionStatus {
    OK("ok"),
    NEEDS_ATTENTION("needs_attention");

    private final String label;

    ReflectionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ReflectionStatus fromLabel(String label) {
        for (ReflectionStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown reflection status: " + label);
    }
}
