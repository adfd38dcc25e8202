package com.vita.causality.tool;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.GlucoseReading;
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
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects post-meal glucose crashes in the window.
 * <p>
 * Score = 0.5 × crash severity + 0.3 × post-crash HRV drop + 0.2 × meal attribution, where
 * severity is the peak-to-nadir fall over 60 mg/dL and a meal is attributed when it was eaten
 * 30 to 150 minutes before the nadir. A strong metabolic score argues against a digital cause.
 */
@Component
@Order(1)
public class MetabolicScanner implements AnalysisTool {

    public static final String NAME = "MetabolicScanner";

    static final int MIN_READINGS = 3;
    static final double STRONG_SCORE = 0.7;
    static final double DIGITAL_SUPPRESSION = -0.3;

    private final HealthDataStore store;

    public MetabolicScanner(HealthDataStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<DebtType> getTargetDebtTypes() {
        return Set.of(DebtType.METABOLIC);
    }

    @Override
    public ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window) {
        List<GlucoseReading> glucose = store.queryGlucose(window);
        List<MealEvent> meals = store.queryMeals(window);
        List<PhysiologicalSample> hrv = store.querySamples(MetricType.HRV_SDNN, window);

        if (glucose.size() < MIN_READINGS) {
            return ToolObservation.builder()
                    .toolName(NAME)
                    .evidence(Map.of(DebtType.METABOLIC, 0.0))
                    .confidence(0.1)
                    .detail("Insufficient glucose data (" + glucose.size() + " readings)")
                    .build();
        }

        GlucoseReading peak = glucose.stream()
                .max(Comparator.comparingDouble(GlucoseReading::getGlucoseMgDl))
                .orElseThrow();
        Optional<GlucoseReading> nadir = glucose.stream()
                .filter(reading -> reading.getTimestamp().isAfter(peak.getTimestamp()))
                .min(Comparator.comparingDouble(GlucoseReading::getGlucoseMgDl));

        double crashDelta = nadir.map(n -> peak.getGlucoseMgDl() - n.getGlucoseMgDl()).orElse(0.0);
        double crashSeverity = Math.min(Math.max(crashDelta, 0.0) / 60.0, 1.0);

        double hrvDrop = 0.0;
        double avgHrv = PhysiologicalSample.average(hrv).orElse(0.0);
        if (nadir.isPresent() && avgHrv > 0) {
            List<PhysiologicalSample> postCrash = hrv.stream()
                    .filter(sample -> sample.getTimestamp().isAfter(nadir.get().getTimestamp()))
                    .toList();
            if (!postCrash.isEmpty()) {
                double postAvg = PhysiologicalSample.average(postCrash).orElse(avgHrv);
                hrvDrop = Math.max((avgHrv - postAvg) / avgHrv, 0.0);
            }
        }

        Optional<MealEvent> relatedMeal = nadir.flatMap(n -> meals.stream()
                .filter(meal -> {
                    Duration delta = Duration.between(meal.getTimestamp(), n.getTimestamp());
                    return delta.compareTo(Duration.ofMinutes(30)) > 0 && delta.compareTo(Duration.ofMinutes(150)) < 0;
                })
                .findFirst());

        double mealAttribution = relatedMeal.isPresent() ? 1.0 : 0.0;
        double metabolicScore = crashSeverity * 0.5 + Math.min(hrvDrop, 1.0) * 0.3 + mealAttribution * 0.2;

        Map<DebtType, Double> evidence = new EnumMap<>(DebtType.class);
        evidence.put(DebtType.METABOLIC, metabolicScore);
        if (metabolicScore > STRONG_SCORE) {
            evidence.put(DebtType.DIGITAL, DIGITAL_SUPPRESSION);
        }

        String mealDetail = relatedMeal.map(meal -> "Meal: " + meal.getSource().label()).orElse("No meal attributed");
        return ToolObservation.builder()
                .toolName(NAME)
                .evidence(evidence)
                .confidence(Math.min(glucose.size() / 12.0, 1.0))
                .detail("Crash: " + (int) crashDelta + "mg/dL, HRV drop: " + (int) (hrvDrop * 100) + "%, " + mealDetail)
                .build();
    }
}
