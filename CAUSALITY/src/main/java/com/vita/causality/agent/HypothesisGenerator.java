package com.vita.causality.agent;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;
import com.vita.causality.domain.model.TimeWindow;
import com.vita.causality.domain.repository.HealthDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Thought stage: builds one hypothesis per debt category from the raw windowed data.
 * <p>
 * Confidences are fixed functions of the signals so that cold-start behavior is predictable.
 */
@Slf4j
@Component
public class HypothesisGenerator {

    static final double HIGH_GL = 25.0;
    static final double VERY_HIGH_GL = 35.0;
    static final double SLEEP_DEFICIT_HOURS = 7.0;
    static final double PLACEHOLDER_CONFIDENCE = 0.15;

    static final List<String> SKIN_KEYWORDS = List.of(
            "skin", "acne", "pimple", "dark circle", "eye bag", "oily", "oiliness",
            "pore", "wrinkle", "redness", "complexion", "face", "breakout", "pigment",
            "spot", "texture", "dry skin", "hydration");

    static final List<String> DARK_CIRCLE_KEYWORDS = List.of("dark circle", "eye bag", "dark eye", "puffy eye");

    private final HealthDataStore store;

    public HypothesisGenerator(HealthDataStore store) {
        this.store = store;
    }

    /**
     * Generate hypotheses for every category, sorted by descending confidence.
     */
    public List<Hypothesis> generate(String symptom, TimeWindow window) {
        List<GlucoseReading> glucose = store.queryGlucose(window);
        List<MealEvent> meals = store.queryMeals(window);
        List<BehavioralEvent> behaviors = store.queryBehaviors(window);
        List<EnvironmentalCondition> environment = store.queryEnvironment(window);
        List<PhysiologicalSample> hrv = store.querySamples(MetricType.HRV_SDNN, window);
        List<PhysiologicalSample> sleep = store.querySamples(MetricType.SLEEP_ANALYSIS, window);

        List<Hypothesis> hypotheses = new ArrayList<>();

        // Metabolic
        boolean hasCrash = glucose.stream().anyMatch(GlucoseReading::isCrash);
        OptionalDouble maxHighGl = meals.stream()
                .mapToDouble(MealEvent::effectiveGlycemicLoad)
                .filter(gl -> gl > HIGH_GL)
                .max();
        boolean hasHighGlMeal = maxHighGl.isPresent();
        double maxGl = maxHighGl.orElse(0.0);

        if (hasCrash || hasHighGlMeal) {
            List<String> chain = new ArrayList<>();
            if (!meals.isEmpty()) {
                MealEvent last = meals.get(meals.size() - 1);
                chain.add(last.displayName() + " (GL " + (int) last.effectiveGlycemicLoad() + ")");
            }
            if (hasCrash) {
                chain.add("Glucose crash detected");
            }
            PhysiologicalSample.average(hrv).ifPresent(avg -> chain.add("HRV: " + (int) avg + "ms"));

            double confidence;
            if (hasCrash) {
                confidence = 0.76;
            } else if (maxGl > VERY_HIGH_GL) {
                confidence = 0.68;
            } else {
                confidence = 0.58;
            }

            hypotheses.add(Hypothesis.builder()
                    .debtType(DebtType.METABOLIC)
                    .description("Post-meal glucose crash or high glycemic load")
                    .confidence(confidence)
                    .causalChain(chain)
                    .supportingEvidence(List.of(hasCrash
                            ? "Glucose crash detected in window"
                            : "High-GL meal (GL " + (int) maxGl + ") detected"))
                    .priorProbability(0.45)
                    .build());
        } else if (!meals.isEmpty()) {
            hypotheses.add(Hypothesis.builder()
                    .debtType(DebtType.METABOLIC)
                    .description("Meal-related metabolic impact")
                    .confidence(0.40)
                    .causalChain(List.of("Meals detected, no crash"))
                    .priorProbability(0.30)
                    .build());
        }

        // Digital
        List<BehavioralEvent> passive = behaviors.stream().filter(BehavioralEvent::isPassive).toList();
        if (!passive.isEmpty()) {
            double totalMinutes = passive.stream().mapToDouble(BehavioralEvent::minutes).sum();
            double maxDebt = passive.stream()
                    .map(BehavioralEvent::getDopamineDebtScore)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .max()
                    .orElse(0.0);

            hypotheses.add(Hypothesis.builder()
                    .debtType(DebtType.DIGITAL)
                    .description("Passive screen time and dopamine debt")
                    .confidence(Math.min(0.45 + totalMinutes / 200.0, 0.80))
                    .causalChain(List.of(
                            (int) totalMinutes + "min passive screen time",
                            "Dopamine debt: " + (int) maxDebt))
                    .supportingEvidence(List.of(
                            passive.size() + " passive events, " + (int) totalMinutes + " total minutes"))
                    .priorProbability(0.35)
                    .build());
        }

        // Somatic
        double totalSleep = PhysiologicalSample.sum(sleep);
        boolean hasSleepDeficit = sleep.isEmpty() || totalSleep < SLEEP_DEFICIT_HOURS;
        boolean hasEnvStress = environment.stream().anyMatch(EnvironmentalCondition::isStressful);
        Optional<EnvironmentalCondition> lastEnvironment = environment.isEmpty()
                ? Optional.empty()
                : Optional.of(environment.get(environment.size() - 1));

        if (hasSleepDeficit || hasEnvStress) {
            List<String> chain = new ArrayList<>();
            if (hasSleepDeficit) {
                chain.add(String.format(Locale.ROOT, "Sleep: %.1fh", totalSleep));
            }
            if (hasEnvStress) {
                lastEnvironment.ifPresent(env ->
                        chain.add("AQI: " + env.getAqiUs() + ", Pollen: " + env.getPollenIndex()));
            }

            hypotheses.add(Hypothesis.builder()
                    .debtType(DebtType.SOMATIC)
                    .description("Environmental or sleep-related stress")
                    .confidence(hasSleepDeficit && hasEnvStress ? 0.70 : 0.55)
                    .causalChain(chain)
                    .supportingEvidence(List.of(hasSleepDeficit
                            ? String.format(Locale.ROOT, "Sleep deficit: %.1fh", totalSleep)
                            : "Environmental stress detected"))
                    .priorProbability(0.35)
                    .build());
        }

        String lowered = symptom.toLowerCase(Locale.ROOT);
        if (containsAny(lowered, SKIN_KEYWORDS)) {
            applySkinOverride(hypotheses, lowered, hasHighGlMeal, maxGl, totalSleep, hasSleepDeficit, lastEnvironment);
        }

        Set<DebtType> covered = EnumSet.noneOf(DebtType.class);
        hypotheses.forEach(h -> covered.add(h.getDebtType()));
        for (DebtType type : DebtType.values()) {
            if (!covered.contains(type)) {
                hypotheses.add(Hypothesis.builder()
                        .debtType(type)
                        .description("No strong indicators for " + type.label() + " debt")
                        .confidence(PLACEHOLDER_CONFIDENCE)
                        .priorProbability(PLACEHOLDER_CONFIDENCE)
                        .build());
            }
        }

        hypotheses.sort(Hypothesis.MOST_CONFIDENT_FIRST);
        log.debug("Generated {} hypotheses for '{}'", hypotheses.size(), symptom);
        return hypotheses;
    }

    /**
     * Replace the routed category's hypothesis with a skin-specific chain when that raises its confidence.
     * Dark-circle symptoms route to somatic; other skin symptoms route to metabolic when a high-GL meal exists.
     */
    private void applySkinOverride(List<Hypothesis> hypotheses, String lowered, boolean hasHighGlMeal, double maxGl,
                                   double totalSleep, boolean hasSleepDeficit,
                                   Optional<EnvironmentalCondition> lastEnvironment) {
        List<String> chain = new ArrayList<>();
        if (hasHighGlMeal) {
            chain.add("High-GL meal (GL " + (int) maxGl + ") -> IGF-1 spike -> sebum overproduction");
        }
        if (totalSleep < SLEEP_DEFICIT_HOURS) {
            chain.add(String.format(Locale.ROOT, "Sleep %.1fh -> cortisol elevation -> skin inflammation", totalSleep));
        }
        lastEnvironment.filter(env -> env.getAqiUs() > 80)
                .ifPresent(env -> chain.add("AQI " + env.getAqiUs() + " -> oxidative stress -> barrier disruption"));
        if (chain.isEmpty()) {
            chain.add("Lifestyle factors -> skin condition");
        }

        DebtType routed;
        if (containsAny(lowered, DARK_CIRCLE_KEYWORDS)) {
            routed = DebtType.SOMATIC;
        } else {
            routed = hasHighGlMeal ? DebtType.METABOLIC : DebtType.SOMATIC;
        }

        double confidence;
        if (hasHighGlMeal && hasSleepDeficit) {
            confidence = 0.78;
        } else if (hasHighGlMeal) {
            confidence = 0.72;
        } else {
            confidence = 0.62;
        }

        double existing = hypotheses.stream()
                .filter(h -> h.getDebtType() == routed)
                .mapToDouble(Hypothesis::getConfidence)
                .findFirst()
                .orElse(0.0);
        if (existing >= confidence) {
            return;
        }

        hypotheses.removeIf(h -> h.getDebtType() == routed);
        hypotheses.add(Hypothesis.builder()
                .debtType(routed)
                .description("Skin condition driven by "
                        + (routed == DebtType.METABOLIC ? "dietary/metabolic" : "sleep/stress") + " factors")
                .confidence(confidence)
                .causalChain(chain)
                .supportingEvidence(List.of("Skin-related question detected"))
                .priorProbability(0.45)
                .build());
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
