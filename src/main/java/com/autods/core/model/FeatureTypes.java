package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Partition of the non-target columns into numeric and categorical features.
 */
public record FeatureTypes(
    @JsonProperty("numeric") List<String> numeric,
    @JsonProperty("categorical") List<String> categorical
) implements Serializable {

    public FeatureTypes {
        numeric = numeric == null ? List.of() : List.copyOf(numeric);
        categorical = categorical == null ? List.of() : List.copyOf(categorical);
    }
}
