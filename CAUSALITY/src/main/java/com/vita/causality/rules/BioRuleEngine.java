package com.vita.causality.rules;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Deterministic fallback that evaluates bio-rules against windowed health data.
 * Used during cold start and when iterative reasoning is inconclusive.
 */
@Slf4j
@Component
public class BioRuleEngine {

    static final Duration DEFAULT_WINDOW = Duration.ofHours(6);

    private final HealthDataStore store;
    private final Clock clock;
    private final List<BioRule> rules;

    @Autowired
    public BioRuleEngine(HealthDataStore store, Clock clock) {
        this(store, clock, DefaultRuleSet.RULES);
    }

    public BioRuleEngine(HealthDataStore store, Clock clock, List<BioRule> rules) {
        this.store = store;
        this.clock = clock;
        this.rules = List.copyOf(rules);
    }

    /**
     * Evaluate the rules over the last six hours.
     */
    public List<CausalExplanation> evaluate(String symptom) {
        return evaluate(symptom, TimeWindow.ending(clock.instant(), DEFAULT_WINDOW));
    }

    /**
     * Evaluate the rules over the given window.
     *
     * @return one explanation per fully matched rule, most specific rule first; empty when none match
     */
    public List<CausalExplanation> evaluate(String symptom, TimeWindow window) {
        RuleContext context = gatherContext(window);

        List<CausalExplanation> explanations = rules.stream()
                .filter(rule -> rule.getConditions().stream().allMatch(c -> matches(c, context)))
                .sorted(Comparator.comparingInt((BioRule rule) -> rule.getConditions().size()).reversed())
                .map(rule -> CausalExplanation.builder()
                        .symptom(symptom)
                        .causalChain(List.of(rule.getName()))
                        .strength(rule.getConfidence())
                        .confidence(rule.getConfidence())
                        .narrative(rule.getExplanation() + " " + rule.getRecommendation())
                        .build())
                .toList();

        log.debug("Bio-rule evaluation matched {} of {} rules", explanations.size(), rules.size());
        return explanations;
    }

    RuleContext gatherContext(TimeWindow window) {
        OptionalDouble avgHrv = PhysiologicalSample.average(store.querySamples(MetricType.HRV_SDNN, window));
        OptionalDouble baselineHrv = PhysiologicalSample.average(
                store.querySamples(MetricType.HRV_SDNN, window.precedingBy(Duration.ofDays(7))));
        Double hrvDropPercent = null;
        if (avgHrv.isPresent() && baselineHrv.isPresent() && baselineHrv.getAsDouble() > 0) {
            hrvDropPercent = (baselineHrv.getAsDouble() - avgHrv.getAsDouble()) / baselineHrv.getAsDouble() * 100;
        }

        List<GlucoseReading> glucose = store.queryGlucose(window);
        Double crashDelta = null;
        if (glucose.size() >= 2) {
            GlucoseReading peak = glucose.stream()
                    .max(Comparator.comparingDouble(GlucoseReading::getGlucoseMgDl))
                    .orElseThrow();
            crashDelta = glucose.stream()
                    .filter(r -> r.getTimestamp().isAfter(peak.getTimestamp()))
                    .map(GlucoseReading::getGlucoseMgDl)
                    .min(Double::compare)
                    .map(nadir -> peak.getGlucoseMgDl() - nadir)
                    .orElse(null);
        }
        Double currentGlucose = glucose.isEmpty() ? null : glucose.get(glucose.size() - 1).getGlucoseMgDl();

        List<PhysiologicalSample> sleep = store.querySamples(MetricType.SLEEP_ANALYSIS, window);

        List<BehavioralEvent> behaviors = store.queryBehaviors(window);
        double passiveMinutes = behaviors.stream()
                .filter(BehavioralEvent::isPassive)
                .mapToDouble(BehavioralEvent::minutes)
                .sum();
        Optional<Double> maxDopamine = behaviors.stream()
                .map(BehavioralEvent::getDopamineDebtScore)
                .filter(Objects::nonNull)
                .max(Double::compare);

        List<EnvironmentalCondition> environment = store.queryEnvironment(window);
        OptionalInt maxAqi = environment.stream().mapToInt(EnvironmentalCondition::getAqiUs).max();
        OptionalInt maxPollen = environment.stream().mapToInt(EnvironmentalCondition::getPollenIndex).max();

        List<MealEvent> meals = store.queryMeals(window);
        OptionalDouble maxGl = meals.stream().mapToDouble(MealEvent::effectiveGlycemicLoad).max();
        double protein = meals.stream()
                .flatMap(meal -> meal.getIngredients().stream())
                .filter(ingredient -> "protein".equals(ingredient.getType()))
                .mapToDouble(ingredient -> ingredient.getQuantityGrams() != null ? ingredient.getQuantityGrams() : 0.0)
                .sum();
        Integer latestMealHour = meals.isEmpty()
                ? null
                : meals.get(meals.size() - 1).getTimestamp().atZone(clock.getZone()).getHour();

        return RuleContext.builder()
                .avgHrv(avgHrv.isPresent() ? avgHrv.getAsDouble() : null)
                .baselineHrv(baselineHrv.isPresent() ? baselineHrv.getAsDouble() : null)
                .hrvDropPercent(hrvDropPercent)
                .glucoseCrashDelta(crashDelta)
                .currentGlucose(currentGlucose)
                .totalSleepHours(sleep.isEmpty() ? null : PhysiologicalSample.sum(sleep))
                .maxDopamineDebt(maxDopamine.orElse(null))
                .passiveMinutes(passiveMinutes)
                .maxAqi(maxAqi.isPresent() ? maxAqi.getAsInt() : null)
                .maxPollen(maxPollen.isPresent() ? maxPollen.getAsInt() : null)
                .totalProteinGrams(protein)
                .maxMealGl(maxGl.isPresent() ? maxGl.getAsDouble() : null)
                .latestMealHour(latestMealHour)
                .build();
    }

    static boolean matches(RuleCondition condition, RuleContext context) {
        double t = condition.threshold();
        return switch (condition.check()) {
            case HRV_BELOW -> below(context.getAvgHrv(), t);
            case HRV_DROP_PERCENT -> above(context.getHrvDropPercent(), t);
            case GLUCOSE_CRASH_DELTA -> above(context.getGlucoseCrashDelta(), t);
            case GLUCOSE_BELOW -> below(context.getCurrentGlucose(), t);
            case SLEEP_BELOW -> below(context.getTotalSleepHours(), t);
            case DOPAMINE_DEBT_ABOVE -> above(context.getMaxDopamineDebt(), t);
            case PASSIVE_MINUTES_ABOVE -> above(context.getPassiveMinutes(), t);
            case AQI_ABOVE -> above(context.getMaxAqi(), t);
            case POLLEN_ABOVE -> above(context.getMaxPollen(), t);
            case PROTEIN_BELOW -> below(context.getTotalProteinGrams(), t);
            case GL_ABOVE -> above(context.getMaxMealGl(), t);
            case LATE_MEAL_AFTER -> context.getLatestMealHour() != null && context.getLatestMealHour() >= t;
        };
    }

    private static boolean above(Number value, double threshold) {
        return value != null && value.doubleValue() > threshold;
    }

    private static boolean below(Number value, double threshold) {
        return value != null && value.doubleValue() < threshold;
    }
}
