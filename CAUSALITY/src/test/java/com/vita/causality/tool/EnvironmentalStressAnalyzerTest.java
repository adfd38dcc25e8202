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

class EnvironmentalStressAnalyzerTest {

    private InMemoryHealthDataStore store;
    private EnvironmentalStressAnalyzer analyzer;
    private TimeWindow window;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        analyzer = new EnvironmentalStressAnalyzer(store);
        window = TimeWindow.lastHours(fixedClock(), 6);
    }

    @Test
    void noEnvironmentalData() {
        ToolObservation observation = analyzer.analyze(List.of(), window);

        assertThat(observation.evidenceFor(DebtType.SOMATIC)).contains(0.0);
        assertThat(observation.getConfidence()).isEqualTo(0.3);
    }

    @Test
    void combinesWorstFactorWithTotalLoad() {
        store.saveEnvironment(environment(minutesAgo(90), 160, 9, 35));

        ToolObservation observation = analyzer.analyze(List.of(), window);

        // max(0.8, 0.5, 0.4) * 0.6 + min(1.7, 1) * 0.4
        assertThat(observation.evidenceFor(DebtType.SOMATIC)).hasValueSatisfying(v ->
                assertThat(v).isCloseTo(0.88, within(1e-9)));
        assertThat(observation.getDetail()).isEqualTo("AQI: 160 (80%), Pollen: 9, Temp: 35C");
    }

    @Test
    void hrvDropConfirmsEnvironmentalStress() {
        store.saveEnvironment(environment(minutesAgo(90), 60, 0, 20));
        store.saveSample(hrv(hoursAgo(48), 60));
        store.saveSample(hrv(minutesAgo(30), 45));

        ToolObservation observation = analyzer.analyze(List.of(), window);

        // 0.2 * 0.6 + 0.2 * 0.4 + drop 0.25
        assertThat(observation.evidenceFor(DebtType.SOMATIC)).hasValueSatisfying(v ->
                assertThat(v).isCloseTo(0.45, within(1e-9)));
    }
}
