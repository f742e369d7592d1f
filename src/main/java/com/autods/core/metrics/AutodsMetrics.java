package com.autods.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class AutodsMetrics {

    private final MeterRegistry registry;

    public AutodsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunDuration(long ms) {
        Timer.builder("autods.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTrainingDuration(long ms) {
        Timer.builder("autods.training.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordIterations(int iterations) {
        DistributionSummary.builder("autods.run.iterations")
                .register(registry)
                .record(iterations);
    }

    public void incrementReplans() {
        Counter.builder("autods.replans.total")
                .register(registry)
                .increment();
    }

    /**
     * Records the best balanced accuracy reached in an iteration.
     */
    public void recordBestBalancedAccuracy(String model, double value) {
        DistributionSummary.builder("autods.best.balanced_accuracy")
                .description("Balanced accuracy of the top-ranked candidate per iteration")
                .tag("model", model)
                .register(registry)
                .record(value);
    }

    /**
     * @param status "success" or the failing exception's simple name
     */
    public void recordRunResult(String status) {
        Counter.builder("autods.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
