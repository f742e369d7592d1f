package com.autods.core.nodes;

import com.autods.core.memory.MemoryStore;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.MemoryRecord;
import com.autods.core.model.RunContext;
import com.autods.core.model.RunStatus;
import com.autods.core.profiling.DatasetProfiler;
import com.autods.core.state.RunDatasets;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import weka.core.Instances;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Profiles the dataset, computes its fingerprint and looks up a memory hint.
 */
@Component
public class ProfileDatasetNode {

    private static final Logger log = LoggerFactory.getLogger(ProfileDatasetNode.class);

    private final DatasetProfiler profiler;
    private final MemoryStore memory;
    private final RunDatasets datasets;

    public ProfileDatasetNode(DatasetProfiler profiler, MemoryStore memory, RunDatasets datasets) {
        this.profiler = profiler;
        this.memory = memory;
        this.datasets = datasets;
    }

    public Map<String, Object> apply(RunState state) {
        RunContext ctx = state.context();
        Instances data = datasets.get(ctx.runId());

        DatasetProfile profile = profiler.profile(data, ctx.target());
        String fingerprint = profiler.fingerprint(data, ctx.target());
        Optional<MemoryRecord> hint = memory.get(fingerprint);
        log.info("Profiled dataset: {} rows, {} cols, imbalance {} (fingerprint {})",
                profile.shape().rows(), profile.shape().cols(), profile.imbalanceRatio(), fingerprint);
        hint.ifPresent(h -> log.info("Memory hint: previously best model {}", h.bestModel()));

        var updates = new HashMap<String, Object>();
        updates.put(RunState.PROFILE, profile);
        updates.put(RunState.FINGERPRINT, fingerprint);
        updates.put(RunState.STATUS, RunStatus.PROFILED.name());
        hint.ifPresent(h -> updates.put(RunState.MEMORY_HINT, h));
        return updates;
    }
}
