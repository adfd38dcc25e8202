package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.OptionalDouble;

/**
 * A wearable measurement. Sleep samples carry hours in {@code value}.
 */
@Value
@Builder(toBuilder = true)
public class PhysiologicalSample {

    Long id;

    MetricType metricType;

    double value;

    String unit;

    Instant timestamp;

    public static OptionalDouble average(Collection<PhysiologicalSample> samples) {
        return samples.stream().mapToDouble(PhysiologicalSample::getValue).average();
    }

    public static double sum(Collection<PhysiologicalSample> samples) {
        return samples.stream().mapToDouble(PhysiologicalSample::getValue).sum();
    }

    public enum MetricType {
        HRV_SDNN,
        RESTING_HEART_RATE,
        SLEEP_ANALYSIS,
        BLOOD_GLUCOSE,
        BLOOD_OXYGEN,
        RESPIRATORY_RATE,
        ACTIVE_ENERGY,
        STEP_COUNT
    }
}
