package com.vita.causality.rules;

import lombok.Builder;
import lombok.Value;

/**
 * Health signals gathered once per evaluation. Null means the signal had no data.
 */
@Value
@Builder
public class RuleContext {
    Double avgHrv;
    Double baselineHrv;
    Double hrvDropPercent;
    Double glucoseCrashDelta;
    Double currentGlucose;
    Double totalSleepHours;
    Double maxDopamineDebt;
    Double passiveMinutes;
    Integer maxAqi;
    Integer maxPollen;
    Double totalProteinGrams;
    Double maxMealGl;
    Integer latestMealHour;
}
