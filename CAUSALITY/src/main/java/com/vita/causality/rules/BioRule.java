package com.vita.causality.rules;

import com.vita.causality.domain.model.DebtType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Deterministic rule that fires when all of its conditions hold.
 */
@Value
@Builder
public class BioRule {

    /** Stable rule identifier */
    String id;

    /** Human-readable name, used as the causal chain of the explanation */
    String name;

    @Singular
    List<RuleCondition> conditions;

    DebtType conclusion;

    String explanation;

    String recommendation;

    /** Confidence reported for explanations from this rule (0.0 to 1.0) */
    double confidence;
}
