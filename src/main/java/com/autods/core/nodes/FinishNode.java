package com.autods.core.nodes;

import com.autods.core.memory.MemoryStore;
import com.autods.core.model.RunStatus;
import com.autods.core.reflection.Reflector;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal node. Notes when the loop stopped only because the replan budget ran out.
 */
@Component
public class FinishNode {

    private static final Logger log = LoggerFactory.getLogger(FinishNode.class);

    private final Reflector reflector;
    private final MemoryStore memory;

    public FinishNode(Reflector reflector, MemoryStore memory) {
        this.reflector = reflector;
        this.memory = memory;
    }

    public Map<String, Object> apply(RunState state) {
        boolean wantsReplan = state.reflection().map(reflector::shouldReplan).orElse(false);
        boolean exhausted = wantsReplan && state.replans() >= state.context().maxReplans();
        if (exhausted) {
            log.warn("Replan budget reached ({}); stopping with the latest results", state.context().maxReplans());
            memory.addNote("Replan budget reached for " + state.fingerprint()
                    + " after " + state.iterations() + " iteration(s); results may be weak.");
        }
        return Map.of(
                RunState.STATUS, RunStatus.DONE.name(),
                RunState.BUDGET_EXHAUSTED, exhausted);
    }
}
