package com.autods.core.nodes;

import com.autods.core.logging.MdcContext;
import com.autods.core.metrics.AutodsMetrics;
import com.autods.core.model.RankedResults;
import com.autods.core.model.RunContext;
import com.autods.core.model.RunStatus;
import com.autods.core.state.RunDatasets;
import com.autods.core.state.RunState;
import com.autods.core.training.CandidateSpec;
import com.autods.core.training.ModelSelector;
import com.autods.core.training.TrainingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Selects candidates for the current profile and trains them.
 */
@Component
public class TrainCandidatesNode {

    private static final Logger log = LoggerFactory.getLogger(TrainCandidatesNode.class);

    private final ModelSelector selector;
    private final TrainingStage trainingStage;
    private final RunDatasets datasets;
    private final AutodsMetrics metrics;

    public TrainCandidatesNode(ModelSelector selector, TrainingStage trainingStage,
                               RunDatasets datasets, AutodsMetrics metrics) {
        this.selector = selector;
        this.trainingStage = trainingStage;
        this.datasets = datasets;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        RunContext ctx = state.context();
        int iteration = state.iterations() + 1;
        MdcContext.setIteration(ctx.runId(), iteration);

        List<CandidateSpec> candidates = selector.select(state.profile(), ctx.seed());
        log.info("Iteration {}: training {} candidates", iteration,
                candidates.stream().map(CandidateSpec::name).toList());

        long start = System.currentTimeMillis();
        RankedResults ranked = trainingStage.train(
                datasets.get(ctx.runId()), ctx.target(), candidates, ctx.seed(), ctx.testSize());
        metrics.recordTrainingDuration(System.currentTimeMillis() - start);

        return Map.of(
                RunState.RANKED, ranked,
                RunState.STATUS, RunStatus.TRAINING.name());
    }
}
