package com.vita.causality.tool;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.domain.repository.HealthDataStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores dopamine debt from genuine passive screen time only.
 * <p>
 * Scrolling that follows a glucose crash is treated as a symptom of the crash. When such
 * reactive minutes dominate, a small metabolic signal is emitted to hand the causal credit back.
 */
@Component
@Order(3)
public class DigitalFrictionAnalyzer implements AnalysisTool {

    public static final String NAME = "DigitalFrictionAnalyzer";

    static final double CONFIDENCE = 0.8;
    static final double REACTIVE_METABOLIC_SIGNAL = 0.15;

    private final HealthDataStore store;

    public DigitalFrictionAnalyzer(HealthDataStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<DebtType> getTargetDebtTypes() {
        return Set.of(DebtType.DIGITAL);
    }

    @Override
    public ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window) {
        List<BehavioralEvent> behaviors = store.queryBehaviors(window);

        if (behaviors.stream().noneMatch(BehavioralEvent::isPassive)) {
            return ToolObservation.builder()
                    .toolName(NAME)
                    .evidence(Map.of(DebtType.DIGITAL, 0.0))
                    .confidence(CONFIDENCE)
                    .detail("No passive screen time detected")
                    .build();
        }

        ScreenTimeSplit split = ScreenTimeSplit.of(behaviors, store.queryGlucose(window));
        double genuineRatio = split.totalMinutes() > 0 ? split.genuineMinutes() / split.totalMinutes() : 0.0;
        double digitalScore = Math.min(split.genuineMinutes() / 60.0, 1.0) * genuineRatio;

        Map<DebtType, Double> evidence = new EnumMap<>(DebtType.class);
        evidence.put(DebtType.DIGITAL, digitalScore);
        if (split.mostlyReactive()) {
            evidence.put(DebtType.METABOLIC, REACTIVE_METABOLIC_SIGNAL);
        }

        return ToolObservation.builder()
                .toolName(NAME)
                .evidence(evidence)
                .confidence(CONFIDENCE)
                .detail("Genuine digital: " + (int) split.genuineMinutes() + "min, Reactive scrolling: "
                        + (int) split.reactiveMinutes() + "min")
                .build();
    }
}
