package com.vita.causality.domain.repository;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.TimeWindow;

import java.time.Instant;
import java.util.List;

/**
 * Access to the personal health graph: time-series records plus learned causal edges.
 * <p>
 * Range queries are inclusive on both ends and return records in ascending timestamp order.
 * Any backend failure surfaces as {@link HealthDataUnavailableException}.
 */
public interface HealthDataStore {

    List<GlucoseReading> queryGlucose(Instant from, Instant to);

    List<MealEvent> queryMeals(Instant from, Instant to);

    List<BehavioralEvent> queryBehaviors(Instant from, Instant to);

    List<EnvironmentalCondition> queryEnvironment(Instant from, Instant to);

    List<PhysiologicalSample> querySamples(PhysiologicalSample.MetricType type, Instant from, Instant to);

    /**
     * Edges leaving the given node.
     */
    List<CausalEdge> queryEdges(String sourceNodeId);

    /**
     * Edges of one type created within the range.
     */
    List<CausalEdge> queryEdges(EdgeType type, Instant from, Instant to);

    /**
     * All edges created within the range.
     */
    List<CausalEdge> queryEdges(Instant from, Instant to);

    /**
     * Insert a new edge or replace the stored edge with the same ID.
     *
     * @return the stored edge, with its ID assigned
     */
    CausalEdge addEdge(CausalEdge edge);

    GlucoseReading saveGlucose(GlucoseReading reading);

    MealEvent saveMeal(MealEvent meal);

    BehavioralEvent saveBehavior(BehavioralEvent event);

    EnvironmentalCondition saveEnvironment(EnvironmentalCondition condition);

    PhysiologicalSample saveSample(PhysiologicalSample sample);

    default List<GlucoseReading> queryGlucose(TimeWindow window) {
        return queryGlucose(window.from(), window.to());
    }

    default List<MealEvent> queryMeals(TimeWindow window) {
        return queryMeals(window.from(), window.to());
    }

    default List<BehavioralEvent> queryBehaviors(TimeWindow window) {
        return queryBehaviors(window.from(), window.to());
    }

    default List<EnvironmentalCondition> queryEnvironment(TimeWindow window) {
        return queryEnvironment(window.from(), window.to());
    }

    default List<PhysiologicalSample> querySamples(PhysiologicalSample.MetricType type, TimeWindow window) {
        return querySamples(type, window.from(), window.to());
    }

    /**
     * Raised when the underlying store cannot serve a query or write.
     */
    class HealthDataUnavailableException extends RuntimeException {
        public HealthDataUnavailableException(String message) {
            super(message);
        }

        public HealthDataUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
