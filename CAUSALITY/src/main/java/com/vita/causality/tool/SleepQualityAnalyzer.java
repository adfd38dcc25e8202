package com.vita.causality.tool;

import com.vita.causality.domain.model.BehavioralEvent;
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares last night's sleep with the seven-day baseline and checks for late high-GL meals
 * and late-night screen time.
 */
@Component
@Order(4)
public class SleepQualityAnalyzer implements AnalysisTool {

    public static final String NAME = "SleepQualityAnalyzer";

    static final Duration OVERNIGHT_LOOKBACK = Duration.ofHours(12);
    static final double DEFAULT_BASELINE_HOURS = 7.5;
    static final int LATE_MEAL_HOUR = 21;
    static final int LATE_SCREEN_HOUR = 22;

    private final HealthDataStore store;
    private final Clock clock;

    public SleepQualityAnalyzer(HealthDataStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<DebtType> getTargetDebtTypes() {
        return Set.of(DebtType.SOMATIC, DebtType.METABOLIC);
    }

    @Override
    public ToolObservation analyze(List<Hypothesis> hypotheses, TimeWindow window) {
        TimeWindow overnight = window.extendBackBy(OVERNIGHT_LOOKBACK);
        List<PhysiologicalSample> sleep = store.querySamples(MetricType.SLEEP_ANALYSIS, overnight);
        double totalSleepHours = PhysiologicalSample.sum(sleep);

        List<PhysiologicalSample> baselineSleep = store.querySamples(MetricType.SLEEP_ANALYSIS,
                window.precedingBy(Duration.ofDays(7)));
        long daysWithSleep = baselineSleep.stream()
                .map(sample -> localDate(sample.getTimestamp()))
                .collect(Collectors.toSet())
                .size();
        double baselineHours = daysWithSleep > 0
                ? PhysiologicalSample.sum(baselineSleep) / daysWithSleep
                : DEFAULT_BASELINE_HOURS;

        double deficitScore = Math.min(Math.max(baselineHours - totalSleepHours, 0.0) / 3.0, 1.0);

        List<MealEvent> lateMeals = store.queryMeals(overnight).stream()
                .filter(meal -> hourOf(meal.getTimestamp()) >= LATE_MEAL_HOUR && meal.effectiveGlycemicLoad() > 25)
                .toList();
        List<BehavioralEvent> lateScreens = store.queryBehaviors(overnight).stream()
                .filter(event -> hourOf(event.getTimestamp()) >= LATE_SCREEN_HOUR && event.isPassive())
                .toList();

        double lateScreenScore = lateScreens.isEmpty() ? 0.0 : 0.2;

        Map<DebtType, Double> evidence = new EnumMap<>(DebtType.class);
        evidence.put(DebtType.SOMATIC, deficitScore * 0.6 + lateScreenScore);
        if (!lateMeals.isEmpty()) {
            evidence.put(DebtType.METABOLIC, 0.3);
        }

        return ToolObservation.builder()
                .toolName(NAME)
                .evidence(evidence)
                .confidence(sleep.isEmpty() ? 0.2 : Math.min(sleep.size() / 4.0, 1.0))
                .detail(String.format(Locale.ROOT, "Sleep: %.1fh (baseline: %.1fh), Late meals: %d, Late screens: %d",
                        totalSleepHours, baselineHours, lateMeals.size(), lateScreens.size()))
                .build();
    }

    private int hourOf(Instant instant) {
        return instant.atZone(clock.getZone()).getHour();
    }

    private LocalDate localDate(Instant instant) {
        return instant.atZone(clock.getZone()).toLocalDate();
    }
}
