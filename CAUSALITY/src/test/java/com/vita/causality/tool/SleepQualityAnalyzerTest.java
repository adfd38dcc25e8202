package com.vita.causality.tool;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.domain.repository.InMemoryHealthDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SleepQualityAnalyzerTest {

    private InMemoryHealthDataStore store;
    private SleepQualityAnalyzer analyzer;
    private TimeWindow window;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        analyzer = new SleepQualityAnalyzer(store, fixedClock());
        window = TimeWindow.lastHours(fixedClock(), 6);
    }

    @Test
    void shortNightWithLateMealAndLateScreen() {
        store.saveSample(sleep(hoursAgo(48), 8.0));
        store.saveSample(sleep(hoursAgo(72), 8.0));
        store.saveSample(sleep(hoursAgo(96), 8.0));
        // logged on waking, after the baseline range closes
        store.saveSample(sleep(hoursAgo(5), 5.0));
        // 22:00 and 23:00 the previous evening
        store.saveMeal(meal(hoursAgo(14), 30));
        store.saveBehavior(passive(hoursAgo(13), 45));

        ToolObservation observation = analyzer.analyze(List.of(), window);

        assertThat(observation.evidenceFor(DebtType.SOMATIC)).hasValueSatisfying(v ->
                assertThat(v).isCloseTo(0.8, within(1e-9)));
        assertThat(observation.evidenceFor(DebtType.METABOLIC)).contains(0.3);
        assertThat(observation.getConfidence()).isEqualTo(0.25);
        assertThat(observation.getDetail())
                .isEqualTo("Sleep: 5.0h (baseline: 8.0h), Late meals: 1, Late screens: 1");
    }

    @Test
    void missingSleepDataUsesDefaultBaseline() {
        ToolObservation observation = analyzer.analyze(List.of(), window);

        assertThat(observation.evidenceFor(DebtType.SOMATIC)).hasValueSatisfying(v ->
                assertThat(v).isCloseTo(0.6, within(1e-9)));
        assertThat(observation.evidenceFor(DebtType.METABOLIC)).isEmpty();
        assertThat(observation.getConfidence()).isEqualTo(0.2);
        assertThat(observation.getDetail()).startsWith("Sleep: 0.0h (baseline: 7.5h)");
    }
}
