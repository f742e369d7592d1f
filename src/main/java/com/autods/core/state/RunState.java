package com.autods.core.state;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.MemoryRecord;
import com.autods.core.model.RankedResults;
import com.autods.core.model.Reflection;
import com.autods.core.model.RunContext;
import com.autods.core.model.RunStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one pipeline run.
 * <p>
 * Every channel is last-write-wins: the replan step hands back a complete new
 * plan and profile rather than deltas. Optional values are simply absent until
 * the node that produces them has run.
 */
public class RunState extends AgentState {

    public static final String CONTEXT = "runContext";
    public static final String STATUS = "status";
    public static final String FINGERPRINT = "fingerprint";
    public static final String PROFILE = "profile";
    public static final String MEMORY_HINT = "memoryHint";
    public static final String INITIAL_PLAN = "initialPlan";
    public static final String PLAN = "plan";
    public static final String RANKED = "ranked";
    public static final String EVALUATION = "evaluation";
    public static final String REFLECTION = "reflection";
    public static final String ITERATIONS = "iterations";
    public static final String REPLANS = "replans";
    public static final String BUDGET_EXHAUSTED = "budgetExhausted";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(CONTEXT,          Channels.base((Reducer<RunContext>) null)),
        Map.entry(STATUS,           Channels.base(() -> RunStatus.INIT.name())),
        Map.entry(FINGERPRINT,      Channels.base(() -> "")),
        Map.entry(PROFILE,          Channels.base((Reducer<DatasetProfile>) null)),
        Map.entry(MEMORY_HINT,      Channels.base((Reducer<MemoryRecord>) null)),
        Map.entry(INITIAL_PLAN,     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(PLAN,             Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(RANKED,           Channels.base((Reducer<RankedResults>) null)),
        Map.entry(EVALUATION,       Channels.base((Reducer<EvaluationPayload>) null)),
        Map.entry(REFLECTION,       Channels.base((Reducer<Reflection>) null)),
        Map.entry(ITERATIONS,       Channels.base(() -> 0)),
        Map.entry(REPLANS,          Channels.base(() -> 0)),
        Map.entry(BUDGET_EXHAUSTED, Channels.base(() -> false))
    );

    public RunState(Map<String, Object> initData) {
        super(initData);
    }

    public RunContext context() {
        return this.<RunContext>value(CONTEXT)
                .orElseThrow(() -> new IllegalStateException("Run context missing from state"));
    }

    public RunStatus status() {
        return RunStatus.valueOf(this.<String>value(STATUS).orElse(RunStatus.INIT.name()));
    }

    public String fingerprint() {
        return this.<String>value(FINGERPRINT).orElse("");
    }

    public DatasetProfile profile() {
        return this.<DatasetProfile>value(PROFILE)
                .orElseThrow(() -> new IllegalStateException("Dataset profile missing from state"));
    }

    public Optional<MemoryRecord> memoryHint() {
        return value(MEMORY_HINT);
    }

    public List<String> initialPlan() {
        return this.<List<String>>value(INITIAL_PLAN).orElse(List.of());
    }

    public List<String> plan() {
        return this.<List<String>>value(PLAN).orElse(List.of());
    }

    public RankedResults ranked() {
        return this.<RankedResults>value(RANKED)
                .orElseThrow(() -> new IllegalStateException("Training results missing from state"));
    }

    public Optional<EvaluationPayload> evaluation() {
        return value(EVALUATION);
    }

    public Optional<Reflection> reflection() {
        return value(REFLECTION);
    }

    /** Completed train/evaluate/reflect cycles. */
    public int iterations() {
        return this.<Integer>value(ITERATIONS).orElse(0);
    }

    public int replans() {
        return this.<Integer>value(REPLANS).orElse(0);
    }

    public boolean budgetExhausted() {
        return this.<Boolean>value(BUDGET_EXHAUSTED).orElse(false);
    }
}
