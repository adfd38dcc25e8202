package com.vita.causality.agent;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.AgentState;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.domain.repository.HealthDataStore;
import com.vita.causality.domain.repository.HealthDataStore.HealthDataUnavailableException;
import com.vita.causality.domain.repository.InMemoryHealthDataStore;
import com.vita.causality.maturity.EngineMaturityTracker;
import com.vita.causality.maturity.MaturityPhase;
import com.vita.causality.maturity.PhaseConfig;
import com.vita.causality.narrative.NarrativeGenerator;
import com.vita.causality.narrative.NarrativeLanguageModel;
import com.vita.causality.observability.CausalityMetrics;
import com.vita.causality.observability.CausalityStructuredLogger;
import com.vita.causality.rules.BioRuleEngine;
import com.vita.causality.scoring.DebtClassifier;
import com.vita.causality.tool.DigitalFrictionAnalyzer;
import com.vita.causality.tool.EnvironmentalStressAnalyzer;
import com.vita.causality.tool.InflammationTracker;
import com.vita.causality.tool.MetabolicScanner;
import com.vita.causality.tool.SleepQualityAnalyzer;
import com.vita.causality.tool.ToolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.vita.causality.HealthDataFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReActAgentTest {

    private static final String SYMPTOM = "Why am I tired?";

    @Mock
    private ObjectProvider<NarrativeLanguageModel> languageModel;
    @Mock
    private EngineMaturityTracker stubbedTracker;

    private InMemoryHealthDataStore store;
    private CausalityProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private CausalityMetrics metrics;

    @BeforeEach
    void setUp() {
        store = new InMemoryHealthDataStore();
        properties = new CausalityProperties();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new CausalityMetrics(meterRegistry);
    }

    @Test
    void coldStartIsAnsweredByRules() {
        givenCrashWithHrvDrop();

        StepVerifier.create(agentOver(store).reason(SYMPTOM))
                .assertNext(explanations -> assertThat(explanations)
                        .extracting(e -> e.getCausalChain().get(0))
                        .containsExactly("Glucose Crash Fatigue"))
                .verifyComplete();

        assertThat(fallbackCount("phase")).isEqualTo(1.0);
        assertThat(metrics.getSessionsCompleted().count()).isEqualTo(1.0);
    }

    @Test
    void coldStartWithoutMatchingRulesReturnsNothing() {
        StepVerifier.create(agentOver(store).reason(SYMPTOM))
                .assertNext(explanations -> assertThat(explanations).isEmpty())
                .verifyComplete();
    }

    @Test
    void strongMetabolicEvidenceResolvesEarly() {
        properties.getMaturity().setForcedPhase(MaturityPhase.CAUSAL);
        store.saveMeal(meal(minutesAgo(180), 40));
        store.saveGlucose(glucose(minutesAgo(170), 110));
        store.saveGlucose(glucose(minutesAgo(120), 180));
        store.saveGlucose(glucose(minutesAgo(60), 105));
        store.saveGlucose(glucose(minutesAgo(30), 115));
        store.saveSample(hrv(minutesAgo(150), 60));
        store.saveSample(hrv(minutesAgo(30), 40));

        StepVerifier.create(agentOver(store).reason(SYMPTOM))
                .assertNext(explanations -> {
                    assertThat(explanations).hasSize(2);
                    CausalExplanation top = explanations.get(0);
                    assertThat(top.getConfidence()).isCloseTo(0.68 + 0.76 / 3, within(1e-9));
                    assertThat(top.getCausalChain()).containsExactly("Roti (GL 40)", "HRV: 50ms");
                    assertThat(top.getNarrative()).startsWith("Looks like your why am i tired?");
                    assertThat(top.getStrength()).isGreaterThan(explanations.get(1).getStrength());
                })
                .verifyComplete();

        assertThat(metrics.getEarlyResolutions().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("causality.tools.invocations").tag("tool", MetabolicScanner.NAME)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void inconclusiveAgentDefersToRules() {
        properties.getMaturity().setForcedPhase(MaturityPhase.CAUSAL);
        properties.getAgent().setResolutionThreshold(1.0);
        properties.getAgent().setRuleOverrideThreshold(0.99);
        givenCrashWithHrvDrop();

        Deliberation deliberation = agentOver(store).deliberate(SYMPTOM);

        assertThat(deliberation.isRuleBased()).isTrue();
        assertThat(deliberation.state().getObservations()).hasSize(3);
        assertThat(deliberation.ruleExplanations()).extracting(e -> e.getCausalChain().get(0))
                .containsExactly("Glucose Crash Fatigue");
        assertThat(fallbackCount("inconclusive")).isEqualTo(1.0);
    }

    @Test
    void inconclusiveAgentKeepsItsAnswerWhenConfidentEnough() {
        properties.getMaturity().setForcedPhase(MaturityPhase.CAUSAL);
        properties.getAgent().setResolutionThreshold(1.01);
        givenCrashWithHrvDrop();

        Deliberation deliberation = agentOver(store).deliberate(SYMPTOM);

        assertThat(deliberation.isRuleBased()).isFalse();
        assertThat(deliberation.state().isResolved()).isFalse();
        assertThat(deliberation.state().topHypothesis()).hasValueSatisfying(top ->
                assertThat(top.getConfidence()).isGreaterThanOrEqualTo(0.4));
        assertThat(deliberation.selected()).isNotEmpty();
        assertThat(inconclusiveFallbacks()).isNull();
    }

    @Test
    void inconclusiveAgentAnswersWhenNoRuleMatches() {
        properties.getMaturity().setForcedPhase(MaturityPhase.CAUSAL);
        properties.getAgent().setResolutionThreshold(1.01);
        properties.getAgent().setRuleOverrideThreshold(0.99);

        Deliberation deliberation = agentOver(store).deliberate(SYMPTOM);

        assertThat(deliberation.isRuleBased()).isFalse();
        assertThat(deliberation.state().isResolved()).isFalse();
        assertThat(deliberation.selected()).isNotEmpty();
        assertThat(inconclusiveFallbacks()).isNull();
    }

    @Test
    void phaseWithoutRulesNeverDefersToThem() {
        when(stubbedTracker.phaseConfig()).thenReturn(new PhaseConfig(true, false, false, 3));
        properties.getAgent().setResolutionThreshold(1.01);
        properties.getAgent().setRuleOverrideThreshold(0.99);
        givenCrashWithHrvDrop();

        Deliberation deliberation = agentOver(store, stubbedTracker).deliberate(SYMPTOM);

        assertThat(deliberation.isRuleBased()).isFalse();
        assertThat(inconclusiveFallbacks()).isNull();
    }

    @Test
    void storeWorkRunsOffTheCallingThread() {
        AtomicReference<String> queryThread = new AtomicReference<>();
        HealthDataStore recording = new InMemoryHealthDataStore() {
            @Override
            public List<com.vita.causality.domain.model.GlucoseReading> queryGlucose(Instant from, Instant to) {
                queryThread.set(Thread.currentThread().getName());
                return super.queryGlucose(from, to);
            }
        };

        StepVerifier.create(agentOver(recording).reason(SYMPTOM))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(queryThread.get()).startsWith("boundedElastic");
    }

    @Test
    void storeFailurePropagates() {
        HealthDataStore failing = new InMemoryHealthDataStore() {
            @Override
            public List<com.vita.causality.domain.model.GlucoseReading> queryGlucose(Instant from, Instant to) {
                throw new HealthDataUnavailableException("glucose table offline");
            }
        };

        StepVerifier.create(agentOver(failing).reason(SYMPTOM))
                .expectError(HealthDataUnavailableException.class)
                .verify();

        assertThat(metrics.getSessionsFailed().count()).isEqualTo(1.0);
    }

    @Test
    void foldClampsAndRecordsEvidence() {
        AgentState state = new AgentState("s-1", SYMPTOM, TimeWindow.lastHours(fixedClock(), 6));
        state.setHypotheses(List.of(
                Hypothesis.builder().debtType(DebtType.METABOLIC).description("m").confidence(0.9).build(),
                Hypothesis.builder().debtType(DebtType.DIGITAL).description("d").confidence(0.15).build()));
        ToolObservation observation = ToolObservation.builder()
                .toolName("Probe")
                .evidence(Map.of(DebtType.METABOLIC, 1.0, DebtType.DIGITAL, -1.0))
                .confidence(1.0)
                .build();

        ReActAgent.fold(state, observation);

        Hypothesis metabolic = state.getHypotheses().get(0);
        Hypothesis digital = state.getHypotheses().get(1);
        assertThat(metabolic.getConfidence()).isEqualTo(1.0);
        assertThat(metabolic.getSupportingEvidence()).containsExactly("Probe: +100%");
        assertThat(digital.getConfidence()).isZero();
        assertThat(digital.getContradictingEvidence()).containsExactly("Probe: -100%");
    }

    private ReActAgent agentOver(HealthDataStore dataStore) {
        return agentOver(dataStore, new EngineMaturityTracker(dataStore, fixedClock(), properties));
    }

    private ReActAgent agentOver(HealthDataStore dataStore, EngineMaturityTracker tracker) {
        Clock clock = fixedClock();
        ToolRegistry registry = new ToolRegistry(List.of(
                new MetabolicScanner(dataStore),
                new InflammationTracker(dataStore),
                new DigitalFrictionAnalyzer(dataStore),
                new SleepQualityAnalyzer(dataStore, clock),
                new EnvironmentalStressAnalyzer(dataStore)));
        return new ReActAgent(
                new HypothesisGenerator(dataStore),
                registry,
                new DebtClassifier(),
                new BioRuleEngine(dataStore, clock),
                new NarrativeGenerator(languageModel, properties, metrics),
                tracker,
                properties,
                metrics,
                new CausalityStructuredLogger(),
                clock);
    }

    private void givenCrashWithHrvDrop() {
        store.saveSample(hrv(hoursAgo(48), 60));
        store.saveSample(hrv(minutesAgo(30), 45));
        store.saveGlucose(glucose(minutesAgo(120), 180));
        store.saveGlucose(glucose(minutesAgo(60), 120));
    }

    private double fallbackCount(String reason) {
        return meterRegistry.get("causality.reasoning.rule_fallback").tag("reason", reason).counter().count();
    }

    private io.micrometer.core.instrument.Counter inconclusiveFallbacks() {
        return meterRegistry.find("causality.reasoning.rule_fallback").tag("reason", "inconclusive").counter();
    }
}
