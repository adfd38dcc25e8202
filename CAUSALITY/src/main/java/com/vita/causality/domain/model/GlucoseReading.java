package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A continuous glucose monitor reading.
 */
@Value
@Builder(toBuilder = true)
public class GlucoseReading {

    Long id;

    double glucoseMgDl;

    Instant timestamp;

    @Builder.Default
    Trend trend = Trend.STABLE;

    @Builder.Default
    EnergyState energyState = EnergyState.STABLE;

    Long relatedMealEventId;

    public boolean isCrash() {
        return energyState == EnergyState.CRASHING || energyState == EnergyState.REACTIVE_LOW;
    }

    public String nodeId() {
        return NodeType.GLUCOSE.nodeId(id);
    }

    public enum Trend {
        RAPIDLY_RISING, RISING, STABLE, FALLING, RAPIDLY_FALLING
    }

    public enum EnergyState {
        /** 70-120 mg/dL, flat curve */
        STABLE,
        /** Post-meal spike in progress */
        RISING,
        /** Rapid decline from peak */
        CRASHING,
        /** Below baseline after a spike */
        REACTIVE_LOW
    }
}
