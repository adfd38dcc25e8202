package com.vita.causality.domain.model;

public enum EdgeType {
    MEAL_TO_GLUCOSE,
    GLUCOSE_TO_HRV,
    GLUCOSE_TO_ENERGY,
    BEHAVIOR_TO_HRV,
    MEAL_TO_SLEEP,
    BEHAVIOR_TO_SLEEP,
    ENVIRONMENT_TO_HRV,
    ENVIRONMENT_TO_SLEEP,
    ENVIRONMENT_TO_DIGESTION,
    BEHAVIOR_TO_MEAL,
    MEAL_TO_SKIN,
    SLEEP_TO_SKIN,
    BEHAVIOR_TO_SKIN,
    ENVIRONMENT_TO_SKIN,
    SKIN_TO_SYMPTOM,
    TEMPORAL,
    CAUSAL
}
