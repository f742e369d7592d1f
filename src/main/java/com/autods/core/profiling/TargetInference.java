package com.autods.core.profiling;

import org.springframework.stereotype.Component;
import weka.core.Instances;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses the target column when the caller asks for {@code auto}.
 * <p>
 * A column with a conventional target name wins (case-insensitive). Otherwise the
 * last column is chosen when it looks categorical: at most 50 distinct values, or
 * fewer distinct values than 5% of the rows.
 */
@Component
public class TargetInference {

    static final List<String> PREFERRED_NAMES = List.of("target", "label", "class", "y", "outcome");
    static final int MAX_DISTINCT = 50;
    static final double MAX_DISTINCT_RATIO = 0.05;

    public Optional<String> infer(Instances data) {
        if (data.numAttributes() == 0) {
            return Optional.empty();
        }
        Map<String, String> byLowerName = new HashMap<>();
        for (int i = 0; i < data.numAttributes(); i++) {
            String name = data.attribute(i).name();
            byLowerName.putIfAbsent(name.toLowerCase(), name);
        }
        for (String preferred : PREFERRED_NAMES) {
            String match = byLowerName.get(preferred);
            if (match != null) {
                return Optional.of(match);
            }
        }

        int last = data.numAttributes() - 1;
        int distinct = data.attributeStats(last).distinctCount;
        int rows = data.numInstances();
        if (rows > 0 && (distinct <= MAX_DISTINCT || (double) distinct / Math.max(rows, 1) < MAX_DISTINCT_RATIO)) {
            return Optional.of(data.attribute(last).name());
        }
        return Optional.empty();
    }
}
