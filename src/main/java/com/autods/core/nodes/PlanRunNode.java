package com.autods.core.nodes;

import com.autods.core.model.RunStatus;
import com.autods.core.planning.Planner;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Asks the planner for the task list. Runs once per run; replans extend this plan.
 */
@Component
public class PlanRunNode {

    private static final Logger log = LoggerFactory.getLogger(PlanRunNode.class);

    private final Planner planner;

    public PlanRunNode(Planner planner) {
        this.planner = planner;
    }

    public Map<String, Object> apply(RunState state) {
        List<String> plan = List.copyOf(planner.createPlan(state.profile(), state.memoryHint().orElse(null)));
        log.info("Plan: {}", plan);
        return Map.of(
                RunState.PLAN, plan,
                RunState.INITIAL_PLAN, plan,
                RunState.STATUS, RunStatus.PLANNED.name());
    }
}
