package com.vita.causality.rules;

import com.vita.causality.domain.model.DebtType;

import java.util.List;

import static com.vita.causality.rules.RuleCondition.Check.*;

/**
 * Built-in bio-rules used during cold start and when iterative reasoning is inconclusive.
 */
public final class DefaultRuleSet {

    public static final List<BioRule> RULES = List.of(
            BioRule.builder()
                    .id("metabolic_crash_fatigue")
                    .name("Glucose Crash Fatigue")
                    .condition(RuleCondition.of(GLUCOSE_CRASH_DELTA, 40))
                    .condition(RuleCondition.of(HRV_DROP_PERCENT, 15))
                    .conclusion(DebtType.METABOLIC)
                    .explanation("Post-meal glucose crash with HRV suppression indicates metabolic fatigue.")
                    .recommendation("Add protein or fat before carbs to flatten the glucose curve.")
                    .confidence(0.75)
                    .build(),
            BioRule.builder()
                    .id("low_protein_recovery")
                    .name("Low Protein Recovery Deficit")
                    .condition(RuleCondition.of(HRV_BELOW, 40))
                    .condition(RuleCondition.of(PROTEIN_BELOW, 20))
                    .conclusion(DebtType.METABOLIC)
                    .explanation("Low HRV combined with insufficient protein intake impairs recovery.")
                    .recommendation("Include 20-30g protein in your next meal for recovery support.")
                    .confidence(0.70)
                    .build(),
            BioRule.builder()
                    .id("digital_dopamine_debt")
                    .name("Dopamine Debt Fatigue")
                    .condition(RuleCondition.of(DOPAMINE_DEBT_ABOVE, 60))
                    .condition(RuleCondition.of(PASSIVE_MINUTES_ABOVE, 40))
                    .conclusion(DebtType.DIGITAL)
                    .explanation("Extended passive screen time has depleted dopamine reserves.")
                    .recommendation("Take a 10-minute walk or engage in a focus-mode work block.")
                    .confidence(0.70)
                    .build(),
            BioRule.builder()
                    .id("late_meal_sleep")
                    .name("Late Meal Sleep Impact")
                    .condition(RuleCondition.of(LATE_MEAL_AFTER, 21))
                    .condition(RuleCondition.of(GL_ABOVE, 30))
                    .conclusion(DebtType.METABOLIC)
                    .explanation("High-GL meal after 9 PM disrupts sleep architecture.")
                    .recommendation("Eat dinner at least 2 hours before bed, keeping GL below 25.")
                    .confidence(0.72)
                    .build(),
            BioRule.builder()
                    .id("aqi_stress")
                    .name("Air Quality Stress")
                    .condition(RuleCondition.of(AQI_ABOVE, 100))
                    .condition(RuleCondition.of(HRV_DROP_PERCENT, 10))
                    .conclusion(DebtType.SOMATIC)
                    .explanation("Poor air quality is causing oxidative stress and HRV suppression.")
                    .recommendation("Stay indoors and use an air purifier when AQI exceeds 100.")
                    .confidence(0.65)
                    .build(),
            BioRule.builder()
                    .id("sleep_deprivation")
                    .name("Sleep Deprivation")
                    .condition(RuleCondition.of(SLEEP_BELOW, 6.5))
                    .condition(RuleCondition.of(HRV_BELOW, 45))
                    .conclusion(DebtType.SOMATIC)
                    .explanation("Insufficient sleep combined with low HRV indicates recovery deficit.")
                    .recommendation("Prioritize 7.5+ hours tonight. Avoid screens 1 hour before bed.")
                    .confidence(0.75)
                    .build(),
            // Scrolling after a crash is attributed to the crash.
            BioRule.builder()
                    .id("reactive_scrolling")
                    .name("Reactive Scrolling Pattern")
                    .condition(RuleCondition.of(GLUCOSE_CRASH_DELTA, 30))
                    .condition(RuleCondition.of(PASSIVE_MINUTES_ABOVE, 20))
                    .conclusion(DebtType.METABOLIC)
                    .explanation("Zombie scrolling occurred after a glucose crash: the fatigue caused the scrolling, "
                            + "not the other way around.")
                    .recommendation("Address the glucose crash with better meal composition. The scrolling will resolve.")
                    .confidence(0.70)
                    .build(),
            BioRule.builder()
                    .id("pollen_fatigue")
                    .name("Pollen Sensitivity Fatigue")
                    .condition(RuleCondition.of(POLLEN_ABOVE, 8))
                    .condition(RuleCondition.of(SLEEP_BELOW, 7.0))
                    .conclusion(DebtType.SOMATIC)
                    .explanation("High pollen is triggering a histamine response, disrupting sleep and causing fatigue.")
                    .recommendation("Consider an antihistamine and keep windows closed on high-pollen days.")
                    .confidence(0.60)
                    .build(),
            BioRule.builder()
                    .id("chronic_high_gl")
                    .name("Chronic High Glycemic Load")
                    .condition(RuleCondition.of(GL_ABOVE, 35))
                    .conclusion(DebtType.METABOLIC)
                    .explanation("Consistently high glycemic load meals are driving glucose volatility.")
                    .recommendation("Aim for GL below 25 per meal. Switch to whole grains and add protein/fat.")
                    .confidence(0.68)
                    .build());

    private DefaultRuleSet() {
    }
}
