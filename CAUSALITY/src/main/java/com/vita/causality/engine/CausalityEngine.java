package com.vita.causality.engine;

import com.vita.causality.agent.ReActAgent;
import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.Counterfactual;
import com.vita.causality.domain.model.NodeType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import com.vita.causality.maturity.EngineMaturityTracker;
import com.vita.causality.maturity.MaturityPhase;
import com.vita.causality.observability.CausalityMetrics;
import com.vita.causality.observability.CausalityStructuredLogger;
import com.vita.causality.observability.CausalityStructuredLogger.LearningEventType;
import com.vita.causality.scm.CausalDag;
import com.vita.causality.scm.EdgeWeightLearner;
import com.vita.causality.scm.EdgeWeightLearner.LearningSummary;
import com.vita.causality.scm.InterventionCalculator;
import com.vita.causality.scoring.DigitalDebtScorer;
import com.vita.causality.scoring.MetabolicDebtScorer;
import com.vita.causality.scoring.SomaticStressScorer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Entry point to the causality engine: symptom queries, counterfactuals, debt scores,
 * edge learning and causal path tracing.
 */
@Slf4j
@Service
public class CausalityEngine {

    private final ReActAgent agent;
    private final InterventionCalculator interventionCalculator;
    private final EdgeWeightLearner edgeWeightLearner;
    private final MetabolicDebtScorer metabolicDebtScorer;
    private final DigitalDebtScorer digitalDebtScorer;
    private final SomaticStressScorer somaticStressScorer;
    private final EngineMaturityTracker maturityTracker;
    private final HealthDataStore store;
    private final CausalityProperties properties;
    private final CausalityMetrics metrics;
    private final CausalityStructuredLogger structuredLogger;
    private final Clock clock;

    public CausalityEngine(
            ReActAgent agent,
            InterventionCalculator interventionCalculator,
            EdgeWeightLearner edgeWeightLearner,
            MetabolicDebtScorer metabolicDebtScorer,
            DigitalDebtScorer digitalDebtScorer,
            SomaticStressScorer somaticStressScorer,
            EngineMaturityTracker maturityTracker,
            HealthDataStore store,
            CausalityProperties properties,
            CausalityMetrics metrics,
            CausalityStructuredLogger structuredLogger,
            Clock clock) {
        this.agent = agent;
        this.interventionCalculator = interventionCalculator;
        this.edgeWeightLearner = edgeWeightLearner;
        this.metabolicDebtScorer = metabolicDebtScorer;
        this.digitalDebtScorer = digitalDebtScorer;
        this.somaticStressScorer = somaticStressScorer;
        this.maturityTracker = maturityTracker;
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public Mono<List<CausalExplanation>> querySymptom(String symptom) {
        log.info("Querying symptom: {}", symptom);
        return agent.reason(symptom);
    }

    public List<Counterfactual> generateCounterfactuals(String nodeId) {
        return interventionCalculator.generateCounterfactuals(nodeId);
    }

    public List<Counterfactual> generateCounterfactuals(String symptom, List<CausalExplanation> explanations) {
        return interventionCalculator.generateCounterfactualsForSymptom(symptom, explanations);
    }

    /**
     * Digestive debt (0-100) over the trailing window.
     */
    public double digestiveDebtScore(int windowHours) {
        return metabolicDebtScorer.score(TimeWindow.lastHours(clock, windowHours));
    }

    public DebtScores debtScores(int windowHours) {
        TimeWindow window = TimeWindow.lastHours(clock, windowHours);
        return new DebtScores(windowHours,
                metabolicDebtScorer.score(window),
                digitalDebtScorer.score(window),
                somaticStressScorer.score(window));
    }

    /**
     * Run one edge-learning batch over the configured lookback.
     */
    public LearningSummary updateGraph() {
        TimeWindow window = TimeWindow.ending(clock.instant(), properties.getLearning().getLookback());
        Timer.Sample sample = metrics.startLearningTimer();
        try {
            LearningSummary summary = edgeWeightLearner.batchUpdate(window);
            metrics.recordLearningCompleted(sample, summary.edgesUpdated(), summary.edgesCreated());
            structuredLogger.logLearningEvent(null, LearningEventType.BATCH_COMPLETED,
                    "Edge learning batch completed",
                    Map.of("mealsScanned", summary.mealsScanned(),
                            "mealsWithResponse", summary.mealsWithResponse(),
                            "edgesUpdated", summary.edgesUpdated(),
                            "edgesCreated", summary.edgesCreated()));
            return summary;
        } catch (RuntimeException e) {
            metrics.recordLearningFailed(sample);
            structuredLogger.logLearningEvent(null, LearningEventType.BATCH_FAILED,
                    "Edge learning batch failed", Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    /**
     * Trace every learned path from a category to the symptom node, strongest first.
     */
    public List<CausalPath> tracePaths(NodeType from) {
        CausalDag dag = new CausalDag(store.queryEdges(Instant.EPOCH, clock.instant()));
        return dag.tracePaths(from).stream()
                .map(path -> new CausalPath(path, dag.pathStrength(path)))
                .sorted(Comparator.comparingDouble(CausalPath::strength).reversed())
                .toList();
    }

    public MaturityPhase currentPhase() {
        return maturityTracker.currentPhase();
    }
}
