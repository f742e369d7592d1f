package com.autods.core.state;

import org.springframework.stereotype.Component;
import weka.core.Instances;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the loaded dataset of each active run, keyed by run id. The data stays
 * out of the graph state so state snapshots remain small.
 */
@Component
public class RunDatasets {

    private final Map<String, Instances> datasets = new ConcurrentHashMap<>();

    public void register(String runId, Instances data) {
        datasets.put(runId, data);
    }

    public Instances get(String runId) {
        Instances data = datasets.get(runId);
        if (data == null) {
            throw new IllegalStateException("No dataset loaded for run " + runId);
        }
        return data;
    }

    public void release(String runId) {
        datasets.remove(runId);
    }
}
