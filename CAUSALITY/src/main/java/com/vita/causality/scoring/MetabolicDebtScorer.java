package com.vita.causality.scoring;

import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Digestive debt score (0-100): average per-meal load from glycemic load, the glucose
 * swing after the meal, the HRV drop after the meal, cooking method and meal timing.
 */
@Component
public class MetabolicDebtScorer {

    static final double DEFAULT_BASELINE_HRV = 50.0;
    static final int LATE_MEAL_HOUR = 20;

    private final HealthDataStore store;
    private final Clock clock;

    public MetabolicDebtScorer(HealthDataStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public double score(TimeWindow window) {
        List<MealEvent> meals = store.queryMeals(window);
        if (meals.isEmpty()) {
            return 0.0;
        }

        double baselineHrv = PhysiologicalSample.average(
                        store.querySamples(MetricType.HRV_SDNN, window.precedingBy(Duration.ofDays(7))))
                .orElse(DEFAULT_BASELINE_HRV);

        double total = 0.0;
        for (MealEvent meal : meals) {
            total += mealDebt(meal, baselineHrv);
        }
        return Math.min(total / meals.size() * 100.0, 100.0);
    }

    private double mealDebt(MealEvent meal, double baselineHrv) {
        Instant eatenAt = meal.getTimestamp();
        double glycemicFactor = Math.min(meal.effectiveGlycemicLoad() / 50.0, 1.0);

        List<GlucoseReading> postMeal = store.queryGlucose(eatenAt, eatenAt.plus(Duration.ofMinutes(150))).stream()
                .filter(r -> r.getTimestamp().isAfter(eatenAt)
                        && r.getTimestamp().isBefore(eatenAt.plus(Duration.ofMinutes(150))))
                .toList();
        Optional<GlucoseReading> peakReading = postMeal.stream()
                .max(Comparator.comparingDouble(GlucoseReading::getGlucoseMgDl));
        double peak = peakReading.map(GlucoseReading::getGlucoseMgDl).orElse(100.0);
        double nadir = peakReading
                .flatMap(p -> postMeal.stream()
                        .filter(r -> r.getTimestamp().isAfter(p.getTimestamp()))
                        .map(GlucoseReading::getGlucoseMgDl)
                        .min(Double::compare))
                .orElse(peak);
        double spike = Math.min((peak - nadir) / 80.0, 1.0);

        double postMealHrv = PhysiologicalSample.average(store.querySamples(MetricType.HRV_SDNN,
                        eatenAt.plus(Duration.ofMinutes(60)), eatenAt.plus(Duration.ofMinutes(180))))
                .orElse(baselineHrv);
        double hrvDrop = baselineHrv > 0 ? Math.max((baselineHrv - postMealHrv) / baselineHrv, 0.0) : 0.0;

        double cooking = cookingFactor(meal.getBioavailabilityModifier());
        double timing = eatenAt.atZone(clock.getZone()).getHour() >= LATE_MEAL_HOUR ? 1.3 : 1.0;

        return (glycemicFactor * 0.3 + spike * 0.3 + hrvDrop * 0.25 + (cooking - 0.8) * 0.15) * timing;
    }

    static double cookingFactor(Double bioavailabilityModifier) {
        if (bioavailabilityModifier == null) {
            return 1.0;
        }
        return bioavailabilityModifier > 1.0 ? 0.8 : 1.2;
    }
}
