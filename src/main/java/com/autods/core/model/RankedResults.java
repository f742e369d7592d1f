package com.autods.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Candidate results in ranking order, best first.
 */
public record RankedResults(List<CandidateResult> results) implements Serializable {

    public RankedResults {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("Ranked results require at least one candidate");
        }
        results = List.copyOf(results);
    }

    public CandidateResult best() {
        return results.get(0);
    }

    public List<ModelMetrics> allMetrics() {
        return results.stream().map(CandidateResult::metrics).toList();
    }
}
