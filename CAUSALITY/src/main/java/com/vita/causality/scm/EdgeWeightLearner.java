package com.vita.causality.scm;

import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.NodeType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import com.vita.causality.observability.CausalityStructuredLogger;
import com.vita.causality.observability.CausalityStructuredLogger.LearningEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Online updater for learned edge weights.
 * <p>
 * Each observation moves strength toward 1 (confirmed) or 0 (disconfirmed) by a weight that
 * shrinks as the edge's confidence grows. Confidence rises on every observation and is capped
 * at {@value #MAX_CONFIDENCE}.
 */
@Slf4j
@Component
public class EdgeWeightLearner {

    static final double MAX_CONFIDENCE = 0.99;
    static final double CONFIRM_CONFIDENCE_STEP = 0.02;
    static final double DISCONFIRM_CONFIDENCE_STEP = 0.01;

    static final Duration RESPONSE_WINDOW_START = Duration.ofMinutes(30);
    static final Duration RESPONSE_WINDOW_END = Duration.ofMinutes(120);
    static final double SPIKE_THRESHOLD_MG_DL = 140.0;
    static final double HIGH_GL = 25.0;
    static final double LOW_GL = 20.0;

    private final HealthDataStore store;
    private final Clock clock;
    private final CausalityStructuredLogger structuredLogger;

    public EdgeWeightLearner(HealthDataStore store, Clock clock, CausalityStructuredLogger structuredLogger) {
        this.store = store;
        this.clock = clock;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Apply one confirm/disconfirm observation and write the result back to the store.
     */
    public CausalEdge updateEdge(CausalEdge edge, boolean confirmed) {
        double observationWeight = 1.0 / (1.0 + edge.getConfidence() * 10);
        double strength = edge.getCausalStrength();
        double confidence = edge.getConfidence();

        CausalEdge updated;
        if (confirmed) {
            updated = edge.toBuilder()
                    .causalStrength(strength + (1.0 - strength) * observationWeight)
                    .confidence(Math.min(confidence + CONFIRM_CONFIDENCE_STEP, MAX_CONFIDENCE))
                    .build();
        } else {
            updated = edge.toBuilder()
                    .causalStrength(strength - strength * observationWeight)
                    .confidence(Math.min(confidence + DISCONFIRM_CONFIDENCE_STEP, MAX_CONFIDENCE))
                    .build();
        }

        CausalEdge stored = store.addEdge(updated);
        structuredLogger.logLearningEvent(String.valueOf(stored.getId()),
                confirmed ? LearningEventType.EDGE_CONFIRMED : LearningEventType.EDGE_DISCONFIRMED,
                "Edge weight updated",
                Map.of("strengthBefore", strength,
                        "strengthAfter", stored.getCausalStrength(),
                        "confidenceAfter", stored.getConfidence()));
        return stored;
    }

    /**
     * Mine meal to glucose-response pairs in the window and confirm or disconfirm the
     * corresponding meal to glucose edges, creating them when absent.
     */
    public LearningSummary batchUpdate(TimeWindow window) {
        List<MealEvent> meals = store.queryMeals(window);
        List<GlucoseReading> glucose = store.queryGlucose(window);

        int examined = 0;
        int updated = 0;
        int created = 0;

        for (MealEvent meal : meals) {
            if (meal.getId() == null) {
                continue;
            }
            Optional<GlucoseReading> peak = postMealPeak(meal, glucose);
            if (peak.isEmpty()) {
                continue;
            }
            examined++;

            double gl = meal.effectiveGlycemicLoad();
            boolean spikeOccurred = peak.get().getGlucoseMgDl() > SPIKE_THRESHOLD_MG_DL;
            boolean confirmed = (gl > HIGH_GL && spikeOccurred) || (gl < LOW_GL && !spikeOccurred);

            List<CausalEdge> mealEdges = store.queryEdges(meal.nodeId()).stream()
                    .filter(edge -> edge.getEdgeType() == EdgeType.MEAL_TO_GLUCOSE)
                    .toList();

            for (CausalEdge edge : mealEdges) {
                updateEdge(edge, confirmed);
                updated++;
            }

            if (mealEdges.isEmpty() && peak.get().getId() != null) {
                CausalEdge edge = store.addEdge(CausalEdge.builder()
                        .sourceNodeId(meal.nodeId())
                        .targetNodeId(peak.get().nodeId())
                        .sourceType(NodeType.MEAL)
                        .targetType(NodeType.GLUCOSE)
                        .edgeType(EdgeType.MEAL_TO_GLUCOSE)
                        .causalStrength(spikeOccurred ? 0.6 : 0.3)
                        .confidence(0.3)
                        .temporalOffsetSeconds(Duration.between(meal.getTimestamp(),
                                peak.get().getTimestamp()).getSeconds())
                        .createdAt(clock.instant())
                        .build());
                created++;
                structuredLogger.logLearningEvent(String.valueOf(edge.getId()), LearningEventType.EDGE_CREATED,
                        "Created meal to glucose edge",
                        Map.of("mealId", meal.getId(),
                                "glycemicLoad", gl,
                                "peakMgDl", peak.get().getGlucoseMgDl(),
                                "confirmed", confirmed));
            }
        }

        LearningSummary summary = new LearningSummary(meals.size(), examined, updated, created);
        log.debug("Batch edge update over {} finished: {}", window, summary);
        return summary;
    }

    /**
     * Highest reading strictly inside the 30 to 120 minute response window after the meal.
     */
    static Optional<GlucoseReading> postMealPeak(MealEvent meal, List<GlucoseReading> glucose) {
        return glucose.stream()
                .filter(reading -> {
                    Duration delta = Duration.between(meal.getTimestamp(), reading.getTimestamp());
                    return delta.compareTo(RESPONSE_WINDOW_START) > 0 && delta.compareTo(RESPONSE_WINDOW_END) < 0;
                })
                .max(Comparator.comparingDouble(GlucoseReading::getGlucoseMgDl));
    }

    /**
     * Outcome of one batch update.
     */
    public record LearningSummary(int mealsScanned, int mealsWithResponse, int edgesUpdated, int edgesCreated) {
    }
}
