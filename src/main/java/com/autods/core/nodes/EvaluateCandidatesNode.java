package com.autods.core.nodes;

import com.autods.core.evaluation.Evaluator;
import com.autods.core.metrics.AutodsMetrics;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.RunStatus;
import com.autods.core.state.RunState;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

@Component
public class EvaluateCandidatesNode {

    private final Evaluator evaluator;
    private final AutodsMetrics metrics;

    public EvaluateCandidatesNode(Evaluator evaluator, AutodsMetrics metrics) {
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        EvaluationPayload evaluation = evaluator.evaluate(state.ranked(), Path.of(state.context().outputDir()));
        metrics.recordBestBalancedAccuracy(evaluation.bestMetrics().model(),
                evaluation.bestMetrics().balancedAccuracy());
        return Map.of(
                RunState.EVALUATION, evaluation,
                RunState.STATUS, RunStatus.EVALUATED.name());
    }
}
