package com.vita.causality.agent;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.GlucoseReading.EnergyState;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.InMemoryHealthDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class HypothesisGeneratorTest {

    private InMemoryHealthDataStore store;
    private HypothesisGenerator generator;
    private TimeWindow window;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        generator = new HypothesisGenerator(store);
        window = TimeWindow.lastHours(fixedClock(), 6);
    }

    @Test
    void crashAfterHighGlMealLeadsWithMetabolic() {
        store.saveMeal(meal(minutesAgo(180), 42));
        store.saveGlucose(glucose(minutesAgo(60), 68, EnergyState.CRASHING));
        store.saveSample(sleep(hoursAgo(5), 8.0));

        List<Hypothesis> hypotheses = generator.generate("Why am I tired?", window);

        assertThat(hypotheses).extracting(Hypothesis::getDebtType)
                .containsExactly(DebtType.METABOLIC, DebtType.DIGITAL, DebtType.SOMATIC);
        Hypothesis metabolic = hypotheses.get(0);
        assertThat(metabolic.getConfidence()).isEqualTo(0.76);
        assertThat(metabolic.getCausalChain()).containsExactly("Roti (GL 42)", "Glucose crash detected");
        assertThat(hypotheses.get(1).getConfidence()).isEqualTo(0.15);
        assertThat(hypotheses.get(1).getDescription()).isEqualTo("No strong indicators for digital debt");
        assertThat(hypotheses.get(2).getConfidence()).isEqualTo(0.15);
    }

    @Test
    void passiveScreenTimeAndMissingSleep() {
        store.saveBehavior(passive(minutesAgo(90), 60, 70.0));

        List<Hypothesis> hypotheses = generator.generate("Brain fog", window);

        assertThat(hypotheses.get(0).getDebtType()).isEqualTo(DebtType.DIGITAL);
        assertThat(hypotheses.get(0).getConfidence()).isEqualTo(0.75);
        assertThat(hypotheses.get(0).getCausalChain())
                .containsExactly("60min passive screen time", "Dopamine debt: 70");
        assertThat(hypotheses.get(1).getDebtType()).isEqualTo(DebtType.SOMATIC);
        assertThat(hypotheses.get(1).getConfidence()).isEqualTo(0.55);
        assertThat(hypotheses.get(1).getCausalChain()).containsExactly("Sleep: 0.0h");
    }

    @Test
    void mealsWithoutCrashOrHighLoad() {
        store.saveMeal(meal(minutesAgo(120), 12));
        store.saveSample(sleep(hoursAgo(5), 8.0));

        Hypothesis metabolic = generator.generate("Why am I tired?", window).get(0);

        assertThat(metabolic.getDescription()).isEqualTo("Meal-related metabolic impact");
        assertThat(metabolic.getConfidence()).isEqualTo(0.40);
    }

    @Nested
    @DisplayName("Skin symptoms")
    class SkinSymptoms {

        @Test
        void acneAfterHighGlMealRoutesToMetabolic() {
            store.saveMeal(meal(minutesAgo(120), 40));

            Hypothesis top = generator.generate("Why do I have acne?", window).get(0);

            assertThat(top.getDebtType()).isEqualTo(DebtType.METABOLIC);
            assertThat(top.getConfidence()).isEqualTo(0.78);
            assertThat(top.getDescription()).isEqualTo("Skin condition driven by dietary/metabolic factors");
            assertThat(top.getCausalChain()).containsExactly(
                    "High-GL meal (GL 40) -> IGF-1 spike -> sebum overproduction",
                    "Sleep 0.0h -> cortisol elevation -> skin inflammation");
        }

        @Test
        void darkCirclesRouteToSomatic() {
            store.saveSample(sleep(hoursAgo(5), 8.0));

            Hypothesis top = generator.generate("Dark circles under my eyes", window).get(0);

            assertThat(top.getDebtType()).isEqualTo(DebtType.SOMATIC);
            assertThat(top.getConfidence()).isEqualTo(0.62);
            assertThat(top.getCausalChain()).containsExactly("Lifestyle factors -> skin condition");
        }

        @Test
        void strongerExistingHypothesisIsKept() {
            store.saveGlucose(glucose(minutesAgo(60), 68, EnergyState.CRASHING));
            store.saveMeal(meal(minutesAgo(150), 15));
            store.saveSample(sleep(hoursAgo(5), 8.0));
            store.saveEnvironment(environment(minutesAgo(30), 40, 2, 22));

            List<Hypothesis> hypotheses = generator.generate("Oily skin", window);

            // no high-GL meal routes to somatic at 0.62, metabolic crash stays first
            assertThat(hypotheses.get(0).getDebtType()).isEqualTo(DebtType.METABOLIC);
            assertThat(hypotheses.get(0).getConfidence()).isEqualTo(0.76);
            assertThat(hypotheses.get(1).getDebtType()).isEqualTo(DebtType.SOMATIC);
            assertThat(hypotheses.get(1).getConfidence()).isEqualTo(0.62);
        }
    }
}
