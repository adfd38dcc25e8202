package com.vita.causality.maturity;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.repository.HealthDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Derives the engine's maturity phase from data density and learned edge confidence.
 */
@Slf4j
@Component
public class EngineMaturityTracker {

    static final int MIN_RECENT_GLUCOSE = 50;
    static final int MIN_MEALS = 14;
    static final double MIN_EDGE_CONFIDENCE = 0.5;
    static final int MIN_HISTORICAL_GLUCOSE = 100;

    private final HealthDataStore store;
    private final Clock clock;
    private final CausalityProperties properties;

    public EngineMaturityTracker(HealthDataStore store, Clock clock, CausalityProperties properties) {
        this.store = store;
        this.clock = clock;
        this.properties = properties;
    }

    public MaturityPhase currentPhase() {
        MaturityPhase forced = properties.getMaturity().getForcedPhase();
        if (forced != null) {
            return forced;
        }

        Instant now = clock.instant();
        Instant twoWeeksAgo = now.minus(Duration.ofDays(14));
        Instant fourWeeksAgo = now.minus(Duration.ofDays(28));
        Instant eightWeeksAgo = now.minus(Duration.ofDays(56));

        int recentGlucose = store.queryGlucose(twoWeeksAgo, now).size();
        int meals = store.queryMeals(eightWeeksAgo, now).size();
        if (recentGlucose < MIN_RECENT_GLUCOSE || meals < MIN_MEALS) {
            log.debug("Maturity PASSIVE: {} glucose readings in 14d, {} meals in 56d", recentGlucose, meals);
            return MaturityPhase.PASSIVE;
        }

        List<CausalEdge> edges = store.queryEdges(EdgeType.MEAL_TO_GLUCOSE, fourWeeksAgo, now);
        double avgConfidence = edges.stream().mapToDouble(CausalEdge::getConfidence).average().orElse(0.0);
        if (avgConfidence < MIN_EDGE_CONFIDENCE) {
            log.debug("Maturity CORRELATION: mean meal->glucose edge confidence {}", avgConfidence);
            return MaturityPhase.CORRELATION;
        }

        int historicalGlucose = store.queryGlucose(eightWeeksAgo, fourWeeksAgo).size();
        if (historicalGlucose < MIN_HISTORICAL_GLUCOSE) {
            return MaturityPhase.CAUSAL;
        }
        return MaturityPhase.ACTIVE;
    }

    public PhaseConfig phaseConfig() {
        return PhaseConfig.forPhase(currentPhase());
    }
}
