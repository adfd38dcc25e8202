package com.vita.causality;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.EnvironmentalCondition;
import com.vita.causality.domain.model.GlucoseReading;
import com.vita.causality.domain.model.GlucoseReading.EnergyState;
import com.vita.causality.domain.model.MealEvent;
import com.vita.causality.domain.model.PhysiologicalSample;
import com.vita.causality.domain.model.PhysiologicalSample.MetricType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared builders for health records anchored at a fixed instant.
 */
public final class HealthDataFixtures {

    /** Tuesday noon UTC */
    public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private HealthDataFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static Instant minutesAgo(long minutes) {
        return NOW.minus(Duration.ofMinutes(minutes));
    }

    public static Instant hoursAgo(long hours) {
        return NOW.minus(Duration.ofHours(hours));
    }

    public static GlucoseReading glucose(Instant at, double mgDl) {
        return glucose(at, mgDl, EnergyState.STABLE);
    }

    public static GlucoseReading glucose(Instant at, double mgDl, EnergyState state) {
        return GlucoseReading.builder()
                .timestamp(at)
                .glucoseMgDl(mgDl)
                .energyState(state)
                .build();
    }

    public static MealEvent meal(Instant at, double glycemicLoad) {
        return MealEvent.builder()
                .timestamp(at)
                .source(MealEvent.MealSource.ROTIMATIC_NEXT)
                .ingredient(MealEvent.Ingredient.builder().name("Roti").quantityGrams(120.0).type("grain").build())
                .estimatedGlycemicLoad(glycemicLoad)
                .build();
    }

    public static BehavioralEvent passive(Instant at, long minutes) {
        return passive(at, minutes, null);
    }

    public static BehavioralEvent passive(Instant at, long minutes, Double dopamineDebt) {
        return BehavioralEvent.builder()
                .timestamp(at)
                .duration(Duration.ofMinutes(minutes))
                .category(BehavioralEvent.Category.ZOMBIE_SCROLLING)
                .appName("Instagram")
                .dopamineDebtScore(dopamineDebt)
                .build();
    }

    public static EnvironmentalCondition environment(Instant at, int aqi, int pollen, double temperature) {
        return EnvironmentalCondition.builder()
                .timestamp(at)
                .aqiUs(aqi)
                .pollenIndex(pollen)
                .temperatureCelsius(temperature)
                .humidity(50)
                .uvIndex(3)
                .build();
    }

    public static PhysiologicalSample hrv(Instant at, double ms) {
        return sample(MetricType.HRV_SDNN, at, ms);
    }

    public static PhysiologicalSample sleep(Instant at, double hours) {
        return sample(MetricType.SLEEP_ANALYSIS, at, hours);
    }

    public static PhysiologicalSample sample(MetricType type, Instant at, double value) {
        return PhysiologicalSample.builder()
                .metricType(type)
                .timestamp(at)
                .value(value)
                .build();
    }
}
