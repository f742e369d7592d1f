package com.autods.core.nodes;

import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.Reflection;
import com.autods.core.model.RunStatus;
import com.autods.core.reflection.Reflector;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ReflectNode {

    private static final Logger log = LoggerFactory.getLogger(ReflectNode.class);

    private final Reflector reflector;

    public ReflectNode(Reflector reflector) {
        this.reflector = reflector;
    }

    public Map<String, Object> apply(RunState state) {
        EvaluationPayload evaluation = state.evaluation()
                .orElseThrow(() -> new IllegalStateException("Evaluation missing from state"));
        Reflection reflection = reflector.reflect(state.profile(), evaluation.bestMetrics(), evaluation.allMetrics());
        log.info("Reflection: {} (replan recommended: {})", reflection.status().label(),
                reflection.replanRecommended());
        reflection.issues().forEach(issue -> log.info("Issue: {}", issue));
        return Map.of(
                RunState.REFLECTION, reflection,
                RunState.STATUS, RunStatus.REFLECTED.name());
    }
}
