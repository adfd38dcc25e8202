package com.vita.causality.engine;

import com.vita.causality.config.CausalityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic edge-weight learning.
 */
@Slf4j
@Component
public class EdgeLearningJob {

    private final CausalityEngine engine;
    private final CausalityProperties properties;

    public EdgeLearningJob(CausalityEngine engine, CausalityProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${causality.learning.interval:PT1H}",
            initialDelayString = "${causality.learning.interval:PT1H}")
    public void run() {
        if (!properties.getLearning().isEnabled()) {
            return;
        }
        try {
            engine.updateGraph();
        } catch (RuntimeException e) {
            // counted and logged by the engine
            log.warn("Scheduled edge learning failed: {}", e.getMessage());
        }
    }
}
