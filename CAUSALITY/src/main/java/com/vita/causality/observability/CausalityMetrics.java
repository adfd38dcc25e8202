package com.vita.causality.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for CAUSALITY service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Reasoning sessions (latency, outcome, top confidence)</li>
 *     <li>Rule-engine fallbacks and early resolutions</li>
 *     <li>Analysis tool invocations</li>
 *     <li>Edge-weight learning</li>
 * </ul>
 */
@Component
public class CausalityMetrics {

    private final MeterRegistry meterRegistry;

    // Reasoning metrics
    @Getter
    private final Counter sessionsStarted;
    @Getter
    private final Counter sessionsCompleted;
    @Getter
    private final Counter sessionsFailed;
    @Getter
    private final Counter earlyResolutions;
    private final Timer reasoningLatency;
    private final DistributionSummary topConfidence;
    private final DistributionSummary explanationsReturned;
    private final AtomicInteger activeSessions;
    private final Map<String, Counter> fallbacksByReason = new ConcurrentHashMap<>();
    private final Map<String, Counter> toolInvocations = new ConcurrentHashMap<>();

    // Narrative metrics
    @Getter
    private final Counter narrativeModelAccepted;
    @Getter
    private final Counter narrativeTemplateFallbacks;

    // Learning metrics
    @Getter
    private final Counter edgesUpdated;
    @Getter
    private final Counter edgesCreated;
    @Getter
    private final Counter learningRunsFailed;
    private final Timer learningLatency;

    public CausalityMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.sessionsStarted = Counter.builder("causality.reasoning.started")
                .description("Reasoning sessions started")
                .register(meterRegistry);
        this.sessionsCompleted = Counter.builder("causality.reasoning.completed")
                .description("Reasoning sessions completed successfully")
                .register(meterRegistry);
        this.sessionsFailed = Counter.builder("causality.reasoning.failed")
                .description("Reasoning sessions failed")
                .register(meterRegistry);
        this.earlyResolutions = Counter.builder("causality.reasoning.resolved_early")
                .description("Sessions resolved before the iteration cap")
                .register(meterRegistry);
        this.reasoningLatency = Timer.builder("causality.reasoning.latency")
                .description("Reasoning session latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.topConfidence = DistributionSummary.builder("causality.reasoning.confidence")
                .description("Confidence of the top explanation")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.explanationsReturned = DistributionSummary.builder("causality.reasoning.explanations.count")
                .description("Number of explanations returned per session")
                .register(meterRegistry);
        this.activeSessions = meterRegistry.gauge("causality.reasoning.active", new AtomicInteger(0));

        this.narrativeModelAccepted = Counter.builder("causality.narrative.model_accepted")
                .description("Narratives produced by the language model")
                .register(meterRegistry);
        this.narrativeTemplateFallbacks = Counter.builder("causality.narrative.template_fallback")
                .description("Narratives produced from templates")
                .register(meterRegistry);

        this.edgesUpdated = Counter.builder("causality.learning.edges.updated")
                .description("Existing edges updated")
                .register(meterRegistry);
        this.edgesCreated = Counter.builder("causality.learning.edges.created")
                .description("Edges created by batch learning")
                .register(meterRegistry);
        this.learningRunsFailed = Counter.builder("causality.learning.failed")
                .description("Batch learning runs failed")
                .register(meterRegistry);
        this.learningLatency = Timer.builder("causality.learning.latency")
                .description("Batch learning latency")
                .register(meterRegistry);
    }

    // ========== Reasoning Methods ==========

    public Timer.Sample startReasoningTimer() {
        sessionsStarted.increment();
        activeSessions.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordReasoningCompleted(Timer.Sample sample, int explanationCount, double confidence) {
        sample.stop(reasoningLatency);
        sessionsCompleted.increment();
        activeSessions.decrementAndGet();
        explanationsReturned.record(explanationCount);
        if (explanationCount > 0) {
            topConfidence.record(confidence);
        }
    }

    public void recordReasoningFailed(Timer.Sample sample) {
        sample.stop(reasoningLatency);
        sessionsFailed.increment();
        activeSessions.decrementAndGet();
    }

    public void recordEarlyResolution() {
        earlyResolutions.increment();
    }

    public void recordRuleFallback(String reason) {
        fallbacksByReason.computeIfAbsent(reason, r ->
                Counter.builder("causality.reasoning.rule_fallback")
                        .tag("reason", r)
                        .description("Sessions answered by the bio-rule engine")
                        .register(meterRegistry))
                .increment();
    }

    public void recordToolInvocation(String toolName) {
        toolInvocations.computeIfAbsent(toolName, name ->
                Counter.builder("causality.tools.invocations")
                        .tag("tool", name)
                        .description("Analysis tool invocations")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Narrative Methods ==========

    public void recordNarrative(boolean fromModel) {
        if (fromModel) {
            narrativeModelAccepted.increment();
        } else {
            narrativeTemplateFallbacks.increment();
        }
    }

    // ========== Learning Methods ==========

    public Timer.Sample startLearningTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordLearningCompleted(Timer.Sample sample, int updated, int created) {
        sample.stop(learningLatency);
        edgesUpdated.increment(updated);
        edgesCreated.increment(created);
    }

    public void recordLearningFailed(Timer.Sample sample) {
        sample.stop(learningLatency);
        learningRunsFailed.increment();
    }
}
