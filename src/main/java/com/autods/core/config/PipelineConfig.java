package com.autods.core.config;

import com.autods.core.memory.JsonMemoryStore;
import com.autods.core.memory.MemoryStore;
import com.autods.core.planning.DefaultPlanner;
import com.autods.core.planning.Planner;
import com.autods.core.reflection.AppendingReplanStrategy;
import com.autods.core.reflection.ReplanStrategy;
import com.autods.core.reflection.Reflector;
import com.autods.core.reflection.ThresholdReflector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the pluggable policies and the memory store.
 * <p>
 * Each bean backs off when another implementation is registered, so a smarter
 * policy can replace the reference one without touching the orchestrator.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean(MemoryStore.class)
    public MemoryStore memoryStore(AutodsProperties properties) {
        Path path = Path.of(properties.getMemoryPath());
        log.info("Using memory file {}", path.toAbsolutePath());
        return new JsonMemoryStore(path);
    }

    @Bean
    @ConditionalOnMissingBean(Planner.class)
    public Planner planner(AutodsProperties properties) {
        return new DefaultPlanner(properties.getPlanning().getImbalanceThreshold());
    }

    @Bean
    @ConditionalOnMissingBean(Reflector.class)
    public Reflector reflector(AutodsProperties properties) {
        var reflection = properties.getReflection();
        return new ThresholdReflector(reflection.getF1Threshold(), reflection.getMinLift(),
                properties.getPlanning().getImbalanceThreshold());
    }

    @Bean
    @ConditionalOnMissingBean(ReplanStrategy.class)
    public ReplanStrategy replanStrategy() {
        return new AppendingReplanStrategy();
    }
}
