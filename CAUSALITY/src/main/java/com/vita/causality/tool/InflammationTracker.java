package com.vita.causality.tool;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.domain.repository.HealthDataStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks for inflammation markers against a seven-day baseline: overall HRV suppression,
 * post-prandial HRV dips and resting heart-rate elevation. Evidence is split 60/40 between
 * metabolic and somatic.
 */
@Component
@Order(2)
public class InflammationTracker implements AnalysisTool {

    public static final String NAME = "InflammationTracker";

    static final Duration BASELINE = Duration.ofDays(7);
    static final double DEFAULT_BASELINE_HRV = 50.0;
    static final double DEFAULT_BASELINE_HR = 65.0;

    private final HealthDataStore store;

    public InflammationTracker(HealthDataStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<DebtType> getTargetDebtTypes() {
        return Set.of(DebtType.METABOLIC, DebtType.SOMATIC);
    }

    @Override
    public ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window) {
        TimeWindow baselineWindow = window.precedingBy(BASELINE);

        List<PhysiologicalSample> baselineHrv = store.querySamples(MetricType.HRV_SDNN, baselineWindow);
        double avgBaselineHrv = PhysiologicalSample.average(baselineHrv).orElse(DEFAULT_BASELINE_HRV);

        List<PhysiologicalSample> currentHrv = store.querySamples(MetricType.HRV_SDNN, window);
        double avgCurrentHrv = PhysiologicalSample.average(currentHrv).orElse(avgBaselineHrv);

        double hrvDeviation = avgBaselineHrv > 0 ? Math.max((avgBaselineHrv - avgCurrentHrv) / avgBaselineHrv, 0.0) : 0.0;

        double avgBaselineHr = PhysiologicalSample.average(
                store.querySamples(MetricType.RESTING_HEART_RATE, baselineWindow)).orElse(DEFAULT_BASELINE_HR);
        double avgCurrentHr = PhysiologicalSample.average(
                store.querySamples(MetricType.RESTING_HEART_RATE, window)).orElse(avgBaselineHr);
        double hrElevation = avgBaselineHr > 0 ? Math.max((avgCurrentHr - avgBaselineHr) / avgBaselineHr, 0.0) : 0.0;

        double postPrandial = 0.0;
        for (MealEvent meal : store.queryMeals(window)) {
            List<PhysiologicalSample> postMeal = currentHrv.stream()
                    .filter(sample -> {
                        Duration delta = Duration.between(meal.getTimestamp(), sample.getTimestamp());
                        return delta.compareTo(Duration.ofMinutes(60)) > 0 && delta.compareTo(Duration.ofMinutes(120)) < 0;
                    })
                    .toList();
            if (postMeal.isEmpty()) {
                continue;
            }
            double avg = PhysiologicalSample.average(postMeal).orElse(avgBaselineHrv);
            if (avg < avgBaselineHrv * 0.8) {
                postPrandial = Math.max(postPrandial, (avgBaselineHrv - avg) / avgBaselineHrv);
            }
        }

        double inflammation = hrvDeviation * 0.4 + postPrandial * 0.4 + hrElevation * 0.2;

        return ToolObservation.builder()
                .toolName(NAME)
                .evidence(Map.of(
                        DebtType.METABOLIC, inflammation * 0.6,
                        DebtType.SOMATIC, inflammation * 0.4))
                .confidence(Math.min((currentHrv.size() + baselineHrv.size()) / 20.0, 1.0))
                .detail("HRV deviation: " + (int) (hrvDeviation * 100) + "%, Post-prandial: "
                        + (int) (postPrandial * 100) + "%, HR elevation: " + (int) (hrElevation * 100) + "%")
                .build();
    }
}
