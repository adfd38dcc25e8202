package com.vita.causality.agent;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.AgentState;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.maturity.EngineMaturityTracker;
import com.vita.causality.maturity.PhaseConfig;
import com.vita.causality.narrative.NarrativeGenerator;
import com.vita.causality.observability.CausalityMetrics;
import com.vita.causality.observability.CausalityStructuredLogger;
import com.vita.causality.observability.CausalityStructuredLogger.ReasoningEventType;
import com.vita.causality.rules.BioRuleEngine;
import com.vita.causality.scoring.DebtClassifier;
import com.vita.causality.scoring.DebtClassifier.RankedDebt;
import com.vita.causality.tool.AnalysisTool;
import com.vita.causality.tool.ToolRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bounded Thought-Act-Observe agent that explains a symptom.
 *
 * <p>The loop:
 * <ol>
 *   <li>Thought: generate one hypothesis per debt category from windowed data</li>
 *   <li>Act: run the tool the registry picks for the current state</li>
 *   <li>Observe: fold the tool's evidence into the matching hypotheses</li>
 *   <li>Stop when the top hypothesis is confident enough, no tool remains, or the iteration cap is hit</li>
 * </ol>
 * Cold-start phases and inconclusive sessions are answered by the bio-rule engine.
 * Everything before narrative generation is blocking store work and runs on the bounded-elastic scheduler.
 */
@Component
@Slf4j
public class ReActAgent {

    private final HypothesisGenerator hypothesisGenerator;
    private final ToolRegistry toolRegistry;
    private final DebtClassifier debtClassifier;
    private final BioRuleEngine ruleEngine;
    private final NarrativeGenerator narrativeGenerator;
    private final EngineMaturityTracker maturityTracker;
    private final CausalityProperties properties;
    private final CausalityMetrics metrics;
    private final CausalityStructuredLogger structuredLogger;
    private final Clock clock;

    public ReActAgent(
            HypothesisGenerator hypothesisGenerator,
            ToolRegistry toolRegistry,
            DebtClassifier debtClassifier,
            BioRuleEngine ruleEngine,
            NarrativeGenerator narrativeGenerator,
            EngineMaturityTracker maturityTracker,
            CausalityProperties properties,
            CausalityMetrics metrics,
            CausalityStructuredLogger structuredLogger,
            Clock clock) {
        this.hypothesisGenerator = hypothesisGenerator;
        this.toolRegistry = toolRegistry;
        this.debtClassifier = debtClassifier;
        this.ruleEngine = ruleEngine;
        this.narrativeGenerator = narrativeGenerator;
        this.maturityTracker = maturityTracker;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Explain a symptom.
     *
     * @return zero or more explanations, best first; errors with
     *         {@link com.vita.causality.domain.repository.HealthDataStore.HealthDataUnavailableException}
     *         when the store fails
     */
    public Mono<List<CausalExplanation>> reason(String symptom) {
        return Mono.defer(() -> {
            String sessionId = UUID.randomUUID().toString();
            Timer.Sample sample = metrics.startReasoningTimer();

            return Mono.fromCallable(() -> deliberate(sessionId, symptom))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(this::assemble)
                    .doOnSuccess(explanations -> {
                        double top = explanations.isEmpty() ? 0.0 : explanations.get(0).getConfidence();
                        metrics.recordReasoningCompleted(sample, explanations.size(), top);
                        structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.SESSION_COMPLETED,
                                "Reasoning session completed",
                                Map.of("explanations", explanations.size(), "topConfidence", top));
                    })
                    .doOnError(e -> {
                        metrics.recordReasoningFailed(sample);
                        structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.SESSION_FAILED,
                                "Reasoning session failed",
                                Map.of("error", String.valueOf(e.getMessage())));
                    });
        });
    }

    /**
     * Run the synchronous part of a session: phase check, hypotheses, tool loop and rule merge.
     */
    public Deliberation deliberate(String symptom) {
        return deliberate(UUID.randomUUID().toString(), symptom);
    }

    Deliberation deliberate(String sessionId, String symptom) {
        try (var scope = structuredLogger.withSession(sessionId, symptom)) {
            CausalityProperties.Agent config = properties.getAgent();
            PhaseConfig phase = maturityTracker.phaseConfig();
            TimeWindow window = TimeWindow.ending(clock.instant(), config.getAnalysisWindow());
            AgentState state = new AgentState(sessionId, symptom, window);

            structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.SESSION_STARTED,
                    "Reasoning session started",
                    Map.of("useReAct", phase.useReAct(), "maxTools", phase.maxTools()));

            if (!phase.useReAct()) {
                metrics.recordRuleFallback("phase");
                structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.RULE_FALLBACK,
                        "Maturity phase disallows iterative reasoning, using bio-rules", Map.of("reason", "phase"));
                return Deliberation.fromRules(ruleEngine.evaluate(symptom), null);
            }

            // Thought
            state.setHypotheses(hypothesisGenerator.generate(symptom, window));
            structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.HYPOTHESES_GENERATED,
                    "Initial hypotheses generated", hypothesisSummary(state));

            int iterations = Math.min(config.getMaxIterations(), phase.maxTools());
            for (int i = 0; i < iterations && !state.isResolved(); i++) {
                // Act
                Optional<AnalysisTool> tool = toolRegistry.selectTool(state);
                if (tool.isEmpty()) {
                    log.debug("No remaining tool at iteration {}", i);
                    break;
                }
                ToolObservation observation = tool.get().analyze(state.getHypotheses(), window);
                metrics.recordToolInvocation(observation.getToolName());

                // Observe
                state.addObservation(observation);
                fold(state, observation);
                structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.TOOL_OBSERVED,
                        "Tool observation folded",
                        Map.of("tool", observation.getToolName(), "iteration", i + 1,
                                "confidence", observation.getConfidence(), "detail", observation.getDetail()));

                if (state.topHypothesis().map(Hypothesis::getConfidence).orElse(0.0)
                        >= config.getResolutionThreshold()) {
                    state.markResolved();
                    metrics.recordEarlyResolution();
                    structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.RESOLVED,
                            "Top hypothesis reached resolution threshold", hypothesisSummary(state));
                }
            }

            if (!state.isResolved() && phase.useRules()) {
                List<CausalExplanation> ruleResults = ruleEngine.evaluate(symptom, window);
                double best = state.topHypothesis().map(Hypothesis::getConfidence).orElse(0.0);
                boolean agentWeak = state.getHypotheses().isEmpty() || best < config.getRuleOverrideThreshold();
                if (!ruleResults.isEmpty() && agentWeak) {
                    metrics.recordRuleFallback("inconclusive");
                    structuredLogger.logReasoningEvent(sessionId, ReasoningEventType.RULE_FALLBACK,
                            "Agent inconclusive, bio-rules supersede",
                            Map.of("reason", "inconclusive", "bestConfidence", best, "rules", ruleResults.size()));
                    return Deliberation.fromRules(ruleResults, state);
                }
            }

            List<RankedDebt> ranked = debtClassifier.classify(state.getHypotheses(), state.getObservations());
            List<Hypothesis> selected = state.getHypotheses().stream()
                    .filter(h -> h.getConfidence() > config.getExplanationFloor())
                    .limit(config.getMaxExplanations())
                    .toList();
            return Deliberation.fromAgent(state, ranked, selected, phase.useLlm());
        }
    }

    /**
     * Additive update of every hypothesis the observation scores, then re-sort.
     */
    static void fold(AgentState state, ToolObservation observation) {
        for (Hypothesis hypothesis : state.getHypotheses()) {
            Optional<Double> evidence = observation.evidenceFor(hypothesis.getDebtType());
            if (evidence.isEmpty()) {
                continue;
            }
            double score = evidence.get();
            hypothesis.setConfidence(hypothesis.getConfidence() + score * observation.getConfidence());
            if (score > 0) {
                hypothesis.addSupportingEvidence(
                        String.format(Locale.ROOT, "%s: +%.0f%%", observation.getToolName(), score * 100));
            } else if (score < 0) {
                hypothesis.addContradictingEvidence(
                        String.format(Locale.ROOT, "%s: %.0f%%", observation.getToolName(), score * 100));
            }
        }
        state.resort();
    }

    private Mono<List<CausalExplanation>> assemble(Deliberation deliberation) {
        if (deliberation.isRuleBased()) {
            return Mono.just(deliberation.ruleExplanations());
        }

        AgentState state = deliberation.state();
        return Flux.fromIterable(deliberation.selected())
                .concatMap(hypothesis -> narrativeGenerator
                        .generate(state.getSymptom(), hypothesis, state.getObservations(),
                                deliberation.useLanguageModel())
                        .map(narrative -> CausalExplanation.builder()
                                .symptom(state.getSymptom())
                                .causalChain(hypothesis.getCausalChain())
                                .strength(deliberation.strengthOf(hypothesis))
                                .confidence(hypothesis.getConfidence())
                                .narrative(narrative)
                                .build()))
                .collectList();
    }

    private Map<String, Object> hypothesisSummary(AgentState state) {
        return state.topHypothesis()
                .<Map<String, Object>>map(top -> Map.of(
                        "hypotheses", state.getHypotheses().size(),
                        "top", top.getDebtType().label(),
                        "topConfidence", top.getConfidence()))
                .orElse(Map.of("hypotheses", 0));
    }
}
