package com.autods.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AutodsMetricsTest {

    private SimpleMeterRegistry registry;
    private AutodsMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AutodsMetrics(registry);
    }

    @Test
    @DisplayName("durations are recorded as timers")
    void timers() {
        metrics.recordRunDuration(1500);
        metrics.recordTrainingDuration(200);
        metrics.recordTrainingDuration(300);

        assertEquals(1500, registry.get("autods.run.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(2, registry.get("autods.training.duration").timer().count());
    }

    @Test
    @DisplayName("replans and run results are counted")
    void counters() {
        metrics.incrementReplans();
        metrics.incrementReplans();
        metrics.recordRunResult("success");
        metrics.recordRunResult("DataException");

        assertEquals(2.0, registry.get("autods.replans.total").counter().count());
        assertEquals(1.0, registry.get("autods.runs.total").tag("status", "success").counter().count());
        assertEquals(1.0, registry.get("autods.runs.total").tag("status", "DataException").counter().count());
    }

    @Test
    @DisplayName("iterations and best balanced accuracy are summarised")
    void summaries() {
        metrics.recordIterations(2);
        metrics.recordBestBalancedAccuracy("Logistic", 0.8);

        assertEquals(2.0, registry.get("autods.run.iterations").summary().totalAmount());
        assertEquals(0.8, registry.get("autods.best.balanced_accuracy").tag("model", "Logistic")
                .summary().max(), 1e-9);
    }
}
