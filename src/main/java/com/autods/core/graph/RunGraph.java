package com.autods.core.graph;

import com.autods.core.nodes.EvaluateCandidatesNode;
import com.autods.core.nodes.FinishNode;
import com.autods.core.nodes.LoadDatasetNode;
import com.autods.core.nodes.PersistArtifactsNode;
import com.autods.core.nodes.PlanRunNode;
import com.autods.core.nodes.ProfileDatasetNode;
import com.autods.core.nodes.ReflectNode;
import com.autods.core.nodes.ReplanNode;
import com.autods.core.nodes.TrainCandidatesNode;
import com.autods.core.reflection.Reflector;
import com.autods.core.state.RunState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds the LangGraph4j {@link StateGraph} that drives a run.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> load_dataset -> profile_dataset -> plan_run
 *         -> train_candidates -> evaluate_candidates -> reflect -> persist_artifacts
 *         -> [routeAfterPersist]
 *            -> replan -> train_candidates (loop)
 *            -> finish -> END
 * </pre>
 * The graph is compiled per run because its step limit depends on the replan budget.
 */
@Component
public class RunGraph {

    static final String LOAD_DATASET = "load_dataset";
    static final String PROFILE_DATASET = "profile_dataset";
    static final String PLAN_RUN = "plan_run";
    static final String TRAIN_CANDIDATES = "train_candidates";
    static final String EVALUATE_CANDIDATES = "evaluate_candidates";
    static final String REFLECT = "reflect";
    static final String PERSIST_ARTIFACTS = "persist_artifacts";
    static final String REPLAN = "replan";
    static final String FINISH = "finish";

    /** Steps per loop pass: train, evaluate, reflect, persist, replan. */
    static final int STEPS_PER_ITERATION = 5;
    /** Load, profile, plan and finish, plus headroom. */
    static final int FIXED_STEPS = 10;

    private final LoadDatasetNode loadNode;
    private final ProfileDatasetNode profileNode;
    private final PlanRunNode planNode;
    private final TrainCandidatesNode trainNode;
    private final EvaluateCandidatesNode evaluateNode;
    private final ReflectNode reflectNode;
    private final PersistArtifactsNode persistNode;
    private final ReplanNode replanNode;
    private final FinishNode finishNode;
    private final Reflector reflector;

    public RunGraph(LoadDatasetNode loadNode,
                    ProfileDatasetNode profileNode,
                    PlanRunNode planNode,
                    TrainCandidatesNode trainNode,
                    EvaluateCandidatesNode evaluateNode,
                    ReflectNode reflectNode,
                    PersistArtifactsNode persistNode,
                    ReplanNode replanNode,
                    FinishNode finishNode,
                    Reflector reflector) {
        this.loadNode = loadNode;
        this.profileNode = profileNode;
        this.planNode = planNode;
        this.trainNode = trainNode;
        this.evaluateNode = evaluateNode;
        this.reflectNode = reflectNode;
        this.persistNode = persistNode;
        this.replanNode = replanNode;
        this.finishNode = finishNode;
        this.reflector = reflector;
    }

    public CompiledGraph<RunState> compile(int maxReplans) {
        try {
            var graph = new StateGraph<>(RunState.SCHEMA, RunState::new)
                    .addNode(LOAD_DATASET, node_async(loadNode::apply))
                    .addNode(PROFILE_DATASET, node_async(profileNode::apply))
                    .addNode(PLAN_RUN, node_async(planNode::apply))
                    .addNode(TRAIN_CANDIDATES, node_async(trainNode::apply))
                    .addNode(EVALUATE_CANDIDATES, node_async(evaluateNode::apply))
                    .addNode(REFLECT, node_async(reflectNode::apply))
                    .addNode(PERSIST_ARTIFACTS, node_async(persistNode::apply))
                    .addNode(REPLAN, node_async(replanNode::apply))
                    .addNode(FINISH, node_async(finishNode::apply))
                    .addEdge(START, LOAD_DATASET)
                    .addEdge(LOAD_DATASET, PROFILE_DATASET)
                    .addEdge(PROFILE_DATASET, PLAN_RUN)
                    .addEdge(PLAN_RUN, TRAIN_CANDIDATES)
                    .addEdge(TRAIN_CANDIDATES, EVALUATE_CANDIDATES)
                    .addEdge(EVALUATE_CANDIDATES, REFLECT)
                    .addEdge(REFLECT, PERSIST_ARTIFACTS)
                    .addConditionalEdges(PERSIST_ARTIFACTS,
                            edge_async(this::routeAfterPersist),
                            Map.of(REPLAN, REPLAN, FINISH, FINISH))
                    .addEdge(REPLAN, TRAIN_CANDIDATES)
                    .addEdge(FINISH, END);

            CompiledGraph<RunState> compiled = graph.compile(CompileConfig.builder().build());
            compiled.setMaxIterations(recursionLimit(maxReplans));
            return compiled;
        } catch (GraphStateException e) {
            throw new IllegalStateException("Invalid run graph: " + e.getMessage(), e);
        }
    }

    /**
     * Replans only while the reflector asks for it and the budget allows another attempt.
     * The budget is checked after reflecting, so an exhausted budget still finishes normally.
     */
    String routeAfterPersist(RunState state) {
        boolean wantsReplan = state.reflection().map(reflector::shouldReplan).orElse(false);
        if (wantsReplan && state.replans() < state.context().maxReplans()) {
            return REPLAN;
        }
        return FINISH;
    }

    static int recursionLimit(int maxReplans) {
        return (maxReplans + 1) * STEPS_PER_ITERATION + FIXED_STEPS;
    }
}
