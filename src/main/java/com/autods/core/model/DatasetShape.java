package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Row and column counts of a dataset.
 */
public record DatasetShape(
    @JsonProperty("rows") int rows,
    @JsonProperty("cols") int cols
) implements Serializable {}
