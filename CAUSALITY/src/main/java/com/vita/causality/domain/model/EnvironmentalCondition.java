package com.vita.causality.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class EnvironmentalCondition {

    Long id;

    Instant timestamp;

    double temperatureCelsius;

    double humidity;

    int aqiUs;

    double uvIndex;

    int pollenIndex;

    public boolean isStressful() {
        return aqiUs > 100 || pollenIndex >= 8 || temperatureCelsius > 33;
    }
}
