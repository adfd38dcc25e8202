package com.vita.causality.maturity;

/**
 * Capabilities enabled in a maturity phase.
 *
 * @param useReAct whether the iterative agent loop runs
 * @param useRules whether the bio-rule engine may supersede an inconclusive agent session
 * @param useLlm whether narratives may come from a language model
 * @param maxTools upper bound on tool invocations per session
 */
public record PhaseConfig(boolean useReAct, boolean useRules, boolean useLlm, int maxTools) {

    public static PhaseConfig forPhase(MaturityPhase phase) {
        return switch (phase) {
            case PASSIVE -> new PhaseConfig(false, true, false, 0);
            case CORRELATION -> new PhaseConfig(false, true, false, 1);
            case CAUSAL -> new PhaseConfig(true, true, false, 3);
            case ACTIVE -> new PhaseConfig(true, true, true, 3);
        };
    }
}
