package com.vita.causality.maturity;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.CausalEdge;
import com.vita.causality.domain.model.EdgeType;
import com.vita.causality.domain.model.NodeType;
import com.vita.causality.domain.repository.InMemoryHealthDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class EngineMaturityTrackerTest {

    private InMemoryHealthDataStore store;
    private CausalityProperties properties;
    private EngineMaturityTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        properties = new CausalityProperties();
        tracker = new EngineMaturityTracker(store, fixedClock(), properties);
    }

    @Test
    void emptyStoreIsPassive() {
        assertThat(tracker.currentPhase()).isEqualTo(MaturityPhase.PASSIVE);
        assertThat(tracker.phaseConfig().useReAct()).isFalse();
    }

    @Test
    void forcedPhaseWins() {
        properties.getMaturity().setForcedPhase(MaturityPhase.ACTIVE);

        assertThat(tracker.currentPhase()).isEqualTo(MaturityPhase.ACTIVE);
        assertThat(tracker.phaseConfig().useLlm()).isTrue();
    }

    @Test
    void enoughDataWithoutTrustedEdgesIsCorrelation() {
        givenRecentData();

        assertThat(tracker.currentPhase()).isEqualTo(MaturityPhase.CORRELATION);
        assertThat(tracker.phaseConfig().maxTools()).isEqualTo(1);
    }

    @Test
    void trustedEdgesEnableCausalPhase() {
        givenRecentData();
        givenTrustedEdge();

        assertThat(tracker.currentPhase()).isEqualTo(MaturityPhase.CAUSAL);
    }

    @Test
    void longHistoryIsActive() {
        givenRecentData();
        givenTrustedEdge();
        for (int i = 0; i < 100; i++) {
            store.saveGlucose(glucose(hoursAgo(24 * 30 + i), 100));
        }

        assertThat(tracker.currentPhase()).isEqualTo(MaturityPhase.ACTIVE);
    }

    private void givenRecentData() {
        for (int i = 0; i < 50; i++) {
            store.saveGlucose(glucose(hoursAgo(i + 1), 100));
        }
        for (int i = 0; i < 14; i++) {
            store.saveMeal(meal(hoursAgo(12L * i + 1), 20));
        }
    }

    private void givenTrustedEdge() {
        store.addEdge(CausalEdge.builder()
                .sourceNodeId("meal_1")
                .targetNodeId("glucose_2")
                .sourceType(NodeType.MEAL)
                .targetType(NodeType.GLUCOSE)
                .edgeType(EdgeType.MEAL_TO_GLUCOSE)
                .causalStrength(0.6)
                .confidence(0.6)
                .createdAt(hoursAgo(24))
                .build());
    }
}
