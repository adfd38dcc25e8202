package com.vita.causality.health;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.repository.HealthDataStore.HealthDataUnavailableException;
import com.vita.causality.maturity.EngineMaturityTracker;
import com.vita.causality.maturity.MaturityPhase;
import com.vita.causality.maturity.PhaseConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the CAUSALITY service.
 * <p>
 * Reports the maturity phase, the capabilities it enables, and the agent configuration.
 * DOWN when the health data store cannot be queried.
 */
@Slf4j
@Component
public class CausalityHealthIndicator implements ReactiveHealthIndicator {

    private final EngineMaturityTracker maturityTracker;
    private final CausalityProperties properties;

    public CausalityHealthIndicator(EngineMaturityTracker maturityTracker, CausalityProperties properties) {
        this.maturityTracker = maturityTracker;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        try {
            MaturityPhase phase = maturityTracker.currentPhase();
            PhaseConfig config = PhaseConfig.forPhase(phase);
            details.put("maturityPhase", phase.name());
            details.put("maturityPhase.description", phase.displayName());
            details.put("useReAct", config.useReAct());
            details.put("useLlm", config.useLlm());
            details.put("maxTools", config.maxTools());
        } catch (HealthDataUnavailableException e) {
            log.error("Health check failed: health data store unavailable", e);
            details.put("store.error", e.getMessage());
            return Health.down().withDetails(details).build();
        }

        details.put("analysisWindow", properties.getAgent().getAnalysisWindow().toString());
        details.put("maxIterations", properties.getAgent().getMaxIterations());
        details.put("learningEnabled", properties.getLearning().isEnabled());
        details.put("llmEnabled", properties.getNarrative().isLlmEnabled());

        return Health.up().withDetails(details).build();
    }
}
