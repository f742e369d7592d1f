package com.autods.core.nodes;

import com.autods.core.events.EventBus;
import com.autods.core.events.RunEvent;
import com.autods.core.metrics.AutodsMetrics;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReplanResult;
import com.autods.core.model.RunStatus;
import com.autods.core.reflection.ReplanStrategy;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Applies the replan strategy and counts the attempt.
 */
@Component
public class ReplanNode {

    private static final Logger log = LoggerFactory.getLogger(ReplanNode.class);

    private final ReplanStrategy strategy;
    private final EventBus eventBus;
    private final AutodsMetrics metrics;

    public ReplanNode(ReplanStrategy strategy, EventBus eventBus, AutodsMetrics metrics) {
        this.strategy = strategy;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        Reflection reflection = state.reflection()
                .orElseThrow(() -> new IllegalStateException("Reflection missing from state"));
        ReplanResult result = strategy.apply(state.plan(), state.profile(), reflection);
        int replans = state.replans() + 1;

        log.info("Replanning (attempt {}/{})", replans, state.context().maxReplans());
        metrics.incrementReplans();
        eventBus.publish(RunEvent.of(RunEvent.REPLAN_STARTED, state.context().runId(), state.iterations(),
                Map.of("attempt", replans, "plan", result.plan())));
        return Map.of(
                RunState.PLAN, result.plan(),
                RunState.PROFILE, result.profile(),
                RunState.REPLANS, replans,
                RunState.STATUS, RunStatus.REPLAN.name());
    }
}
