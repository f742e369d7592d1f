package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural snapshot of a dataset for one target column.
 * <p>
 * The feature partition is validated on construction: numeric and categorical
 * columns are disjoint and together cover every non-target column.
 * Instances are never mutated; {@link #withNotes(List)} returns a replacement.
 */
public record DatasetProfile(
    @JsonProperty("shape") DatasetShape shape,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("missing_pct") Map<String, Double> missingPct,
    @JsonProperty("target") String target,
    @JsonProperty("target_dtype") String targetType,
    @JsonProperty("is_classification") boolean classification,
    @JsonProperty("feature_types") FeatureTypes featureTypes,
    @JsonProperty("n_unique_by_col") Map<String, Integer> uniqueCounts,
    @JsonProperty("class_counts") Map<String, Integer> classCounts,
    @JsonProperty("imbalance_ratio") double imbalanceRatio,
    @JsonProperty("notes") List<String> notes
) implements Serializable {

    public DatasetProfile {
        columns = List.copyOf(columns);
        missingPct = ordered(missingPct);
        uniqueCounts = ordered(uniqueCounts);
        classCounts = ordered(classCounts);
        notes = notes == null ? List.of() : List.copyOf(notes);
        validatePartition(columns, target, featureTypes);
    }

    public DatasetProfile withNotes(List<String> newNotes) {
        return new DatasetProfile(shape, columns, missingPct, target, targetType, classification,
                featureTypes, uniqueCounts, classCounts, imbalanceRatio, newNotes);
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static void validatePartition(List<String> columns, String target, FeatureTypes featureTypes) {
        if (featureTypes == null) {
            throw new IllegalArgumentException("Feature types are required");
        }
        List<String> features = new ArrayList<>(columns);
        features.remove(target);

        Set<String> numeric = new HashSet<>(featureTypes.numeric());
        Set<String> categorical = new HashSet<>(featureTypes.categorical());
        for (String column : numeric) {
            if (categorical.contains(column)) {
                throw new IllegalArgumentException("Column '" + column + "' is both numeric and categorical");
            }
        }
        Set<String> union = new HashSet<>(numeric);
        union.addAll(categorical);
        if (!union.equals(new HashSet<>(features))) {
            throw new IllegalArgumentException(
                    "Feature types must cover exactly the non-target columns " + features + " but were " + union);
        }
    }
}
