package com.autods.core.nodes;

import com.autods.core.error.PlanningException;
import com.autods.core.model.RunContext;
import com.autods.core.profiling.DatasetLoader;
import com.autods.core.profiling.TargetInference;
import com.autods.core.state.RunDatasets;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import weka.core.Instances;

import java.util.Map;

/**
 * Loads the dataset for the run and resolves an {@code auto} target by inference.
 * <p>
 * An explicit target is taken verbatim; its existence is checked when profiling.
 */
@Component
public class LoadDatasetNode {

    private static final Logger log = LoggerFactory.getLogger(LoadDatasetNode.class);

    private final DatasetLoader loader;
    private final TargetInference targetInference;
    private final RunDatasets datasets;

    public LoadDatasetNode(DatasetLoader loader, TargetInference targetInference, RunDatasets datasets) {
        this.loader = loader;
        this.targetInference = targetInference;
        this.datasets = datasets;
    }

    public Map<String, Object> apply(RunState state) {
        RunContext ctx = state.context();
        Instances data = loader.load(ctx.dataPath());
        datasets.register(ctx.runId(), data);

        if (!ctx.targetIsAuto()) {
            return Map.of(RunState.CONTEXT, ctx);
        }
        String inferred = targetInference.infer(data)
                .orElseThrow(() -> new PlanningException(
                        "Cannot infer target column automatically. Please pass --target <column_name>."));
        log.info("Inferred target column: {}", inferred);
        return Map.of(RunState.CONTEXT, ctx.withTarget(inferred));
    }
}
