package com.vita.causality.domain.repository;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Basic in-memory health graph used until a durable store is wired up.
 */
@Repository
public class InMemoryHealthDataStore implements HealthDataStore {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<Long, GlucoseReading> glucose = new ConcurrentHashMap<>();
    private final Map<Long, MealEvent> meals = new ConcurrentHashMap<>();
    private final Map<Long, BehavioralEvent> behaviors = new ConcurrentHashMap<>();
    private final Map<Long, EnvironmentalCondition> environment = new ConcurrentHashMap<>();
    private final Map<Long, PhysiologicalSample> samples = new ConcurrentHashMap<>();
    private final Map<Long, CausalEdge> edges = new ConcurrentHashMap<>();

    public InMemoryHealthDataStore() {
        this(Clock.systemUTC());
    }

    @Autowired
    public InMemoryHealthDataStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<GlucoseReading> queryGlucose(Instant from, Instant to) {
        return inRange(glucose, GlucoseReading::getTimestamp, from, to);
    }

    @Override
    public List<MealEvent> queryMeals(Instant from, Instant to) {
        return inRange(meals, MealEvent::getTimestamp, from, to);
    }

    @Override
    public List<BehavioralEvent> queryBehaviors(Instant from, Instant to) {
        return inRange(behaviors, BehavioralEvent::getTimestamp, from, to);
    }

    @Override
    public List<EnvironmentalCondition> queryEnvironment(Instant from, Instant to) {
        return inRange(environment, EnvironmentalCondition::getTimestamp, from, to);
    }

    @Override
    public List<PhysiologicalSample> querySamples(PhysiologicalSample.MetricType type, Instant from, Instant to) {
        return inRange(samples, PhysiologicalSample::getTimestamp, from, to).stream()
                .filter(sample -> sample.getMetricType() == type)
                .toList();
    }

    @Override
    public List<CausalEdge> queryEdges(String sourceNodeId) {
        return edges.values().stream()
                .filter(edge -> Objects.equals(edge.getSourceNodeId(), sourceNodeId))
                .sorted(Comparator.comparing(CausalEdge::getId))
                .toList();
    }

    @Override
    public List<CausalEdge> queryEdges(EdgeType type, Instant from, Instant to) {
        return queryEdges(from, to).stream()
                .filter(edge -> edge.getEdgeType() == type)
                .toList();
    }

    @Override
    public List<CausalEdge> queryEdges(Instant from, Instant to) {
        return inRange(edges, CausalEdge::getCreatedAt, from, to);
    }

    @Override
    public CausalEdge addEdge(CausalEdge edge) {
        CausalEdge stored = edge;
        if (stored.getId() == null) {
            stored = stored.toBuilder().id(sequence.incrementAndGet()).build();
        }
        if (stored.getCreatedAt() == null) {
            stored = stored.toBuilder().createdAt(clock.instant()).build();
        }
        edges.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public GlucoseReading saveGlucose(GlucoseReading reading) {
        GlucoseReading stored = reading.getId() != null ? reading
                : reading.toBuilder().id(sequence.incrementAndGet()).build();
        glucose.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public MealEvent saveMeal(MealEvent meal) {
        MealEvent stored = meal.getId() != null ? meal : meal.toBuilder().id(sequence.incrementAndGet()).build();
        meals.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public BehavioralEvent saveBehavior(BehavioralEvent event) {
        BehavioralEvent stored = event.getId() != null ? event
                : event.toBuilder().id(sequence.incrementAndGet()).build();
        behaviors.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public EnvironmentalCondition saveEnvironment(EnvironmentalCondition condition) {
        EnvironmentalCondition stored = condition.getId() != null ? condition
                : condition.toBuilder().id(sequence.incrementAndGet()).build();
        environment.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public PhysiologicalSample saveSample(PhysiologicalSample sample) {
        PhysiologicalSample stored = sample.getId() != null ? sample
                : sample.toBuilder().id(sequence.incrementAndGet()).build();
        samples.put(stored.getId(), stored);
        return stored;
    }

    private static <T> List<T> inRange(Map<Long, T> records, Function<T, Instant> timestamp,
                                       Instant from, Instant to) {
        return records.values().stream()
                .filter(record -> {
                    Instant at = timestamp.apply(record);
                    return at != null && !at.isBefore(from) && !at.isAfter(to);
                })
                .sorted(Comparator.comparing(timestamp))
                .toList();
    }
}
