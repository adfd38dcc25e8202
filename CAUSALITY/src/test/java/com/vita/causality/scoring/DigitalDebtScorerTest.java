package com.vita.causality.scoring;

import com.vita.causality.domain.model.GlucoseReading.EnergyState;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.InMemoryHealthDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DigitalDebtScorerTest {

    private InMemoryHealthDataStore store;
    private DigitalDebtScorer scorer;
    private TimeWindow window;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        scorer = new DigitalDebtScorer(store);
        window = TimeWindow.lastHours(fixedClock(), 24);
    }

    @Test
    void genuineMinutesAndPeakDopamine() {
        store.saveBehavior(passive(hoursAgo(2), 30, 50.0));

        assertThat(scorer.score(window)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void reactiveScrollingIsNotCounted() {
        store.saveGlucose(glucose(minutesAgo(60), 70, EnergyState.CRASHING));
        store.saveBehavior(passive(minutesAgo(45), 60));

        assertThat(scorer.score(window)).isZero();
    }

    @Test
    void cappedAtOneHundred() {
        store.saveBehavior(passive(hoursAgo(5), 120, 150.0));

        assertThat(scorer.score(window)).isEqualTo(100.0);
    }
}
