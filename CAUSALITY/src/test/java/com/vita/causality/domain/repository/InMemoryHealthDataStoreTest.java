package com.vita.causality.domain.repository;

import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryHealthDataStoreTest {

    private InMemoryHealthDataStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore(fixedClock());
    }

    @Test
    void saveAssignsIdentifiers() {
        GlucoseReading stored = store.saveGlucose(glucose(NOW, 110));

        assertThat(stored.getId()).isNotNull();
        assertThat(stored.nodeId()).isEqualTo("glucose_" + stored.getId());
    }

    @Test
    void rangeQueriesAreInclusiveAndOrdered() {
        store.saveGlucose(glucose(minutesAgo(10), 120));
        store.saveGlucose(glucose(minutesAgo(60), 100));
        store.saveGlucose(glucose(minutesAgo(30), 140));
        store.saveGlucose(glucose(minutesAgo(90), 90));

        List<GlucoseReading> readings = store.queryGlucose(minutesAgo(60), minutesAgo(10));

        assertThat(readings).extracting(GlucoseReading::getGlucoseMgDl).containsExactly(100.0, 140.0, 120.0);
    }

    @Test
    void sampleQueriesFilterByMetricType() {
        store.saveSample(hrv(minutesAgo(20), 45));
        store.saveSample(sleep(minutesAgo(20), 7.5));

        assertThat(store.querySamples(MetricType.HRV_SDNN, hoursAgo(1), NOW)).hasSize(1);
        assertThat(store.querySamples(MetricType.SLEEP_ANALYSIS, hoursAgo(1), NOW))
                .singleElement()
                .satisfies(sample -> assertThat(sample.getValue()).isEqualTo(7.5));
    }

    @Test
    void addEdgeInsertsThenReplacesById() {
        CausalEdge created = store.addEdge(CausalEdge.builder()
                .sourceNodeId("meal_1")
                .targetNodeId("glucose_2")
                .edgeType(EdgeType.MEAL_TO_GLUCOSE)
                .causalStrength(0.5)
                .confidence(0.3)
                .createdAt(NOW)
                .build());

        store.addEdge(created.toBuilder().causalStrength(0.8).build());

        assertThat(store.queryEdges("meal_1"))
                .singleElement()
                .satisfies(edge -> {
                    assertThat(edge.getId()).isEqualTo(created.getId());
                    assertThat(edge.getCausalStrength()).isEqualTo(0.8);
                });
        assertThat(store.queryEdges(EdgeType.MEAL_TO_GLUCOSE, hoursAgo(1), NOW)).hasSize(1);
        assertThat(store.queryEdges(EdgeType.GLUCOSE_TO_HRV, hoursAgo(1), NOW)).isEmpty();
    }

    @Test
    void addEdgeStampsMissingCreationTime() {
        CausalEdge stored = store.addEdge(CausalEdge.builder()
                .sourceNodeId("meal_1")
                .targetNodeId("symptom_1")
                .edgeType(EdgeType.CAUSAL)
                .causalStrength(0.8)
                .build());

        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(store.queryEdges(hoursAgo(1), NOW)).singleElement()
                .satisfies(edge -> assertThat(edge.getId()).isEqualTo(stored.getId()));
    }
}
