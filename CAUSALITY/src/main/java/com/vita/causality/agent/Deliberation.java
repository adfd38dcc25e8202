package com.vita.causality.agent;

import com.vita.causality.domain.model.AgentState;
import com.vita.causality.domain.model.CausalExplanation;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.scoring.DebtClassifier.RankedDebt;

import java.util.List;

/**
 * Outcome of the synchronous part of a reasoning session.
 * <p>
 * Either the bio-rule engine answered (cold start or inconclusive agent), or the agent
 * selected hypotheses that still need narratives before they become explanations.
 *
 * @param ruleExplanations final explanations from the rule engine; null when the agent answered
 * @param state the agent state; null when rules answered because the phase disallows the agent loop
 * @param rankedDebts classifier output for the agent's hypotheses
 * @param selected hypotheses above the confidence floor, best first
 * @param useLanguageModel whether the phase permits model-written narratives
 */
public record Deliberation(List<CausalExplanation> ruleExplanations,
                           AgentState state,
                           List<RankedDebt> rankedDebts,
                           List<Hypothesis> selected,
                           boolean useLanguageModel) {

    static Deliberation fromRules(List<CausalExplanation> explanations, AgentState state) {
        return new Deliberation(List.copyOf(explanations), state, List.of(), List.of(), false);
    }

    static Deliberation fromAgent(AgentState state, List<RankedDebt> rankedDebts, List<Hypothesis> selected,
                                  boolean useLanguageModel) {
        return new Deliberation(null, state, List.copyOf(rankedDebts), List.copyOf(selected), useLanguageModel);
    }

    public boolean isRuleBased() {
        return ruleExplanations != null;
    }

    /**
     * Category-level score for a hypothesis, or its own confidence when the classifier has none.
     */
    public double strengthOf(Hypothesis hypothesis) {
        return rankedDebts.stream()
                .filter(ranked -> ranked.type() == hypothesis.getDebtType())
                .mapToDouble(RankedDebt::score)
                .findFirst()
                .orElse(hypothesis.getConfidence());
    }
}
