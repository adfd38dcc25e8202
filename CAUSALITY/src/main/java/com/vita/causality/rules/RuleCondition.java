package com.vita.causality.rules;

/**
 * One threshold check a bio-rule requires. A condition whose input signal is absent never matches.
 */
public record RuleCondition(Check check, double threshold) {

    public static RuleCondition of(Check check, double threshold) {
        return new RuleCondition(check, threshold);
    }

    public enum Check {
        /** Average HRV (ms) below threshold */
        HRV_BELOW,
        /** HRV drop from the 7-day baseline, in percent, above threshold */
        HRV_DROP_PERCENT,
        /** Peak minus post-peak nadir (mg/dL) above threshold */
        GLUCOSE_CRASH_DELTA,
        /** Latest glucose reading below threshold */
        GLUCOSE_BELOW,
        /** Total sleep hours below threshold */
        SLEEP_BELOW,
        DOPAMINE_DEBT_ABOVE,
        PASSIVE_MINUTES_ABOVE,
        AQI_ABOVE,
        POLLEN_ABOVE,
        /** Total protein grams below threshold */
        PROTEIN_BELOW,
        /** Highest meal glycemic load above threshold */
        GL_ABOVE,
        /** Latest meal hour at or after threshold */
        LATE_MEAL_AFTER
    }
}
