package com.vita.causality.scoring;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.ToolObservation;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds hypotheses and tool observations into a normalized category distribution.
 */
@Component
public class DebtClassifier {

    private static final Map<DebtType, Double> UNIFORM_PRIOR = Map.of(
            DebtType.METABOLIC, 0.33,
            DebtType.DIGITAL, 0.33,
            DebtType.SOMATIC, 0.34);

    /**
     * Score each category.
     *
     * @return categories sorted by descending normalized score; empty when every raw score is zero
     */
    public List<RankedDebt> classify(List<Hypothesis> hypotheses, List<ToolObservation> observations) {
        Map<DebtType, Double> raw = new EnumMap<>(UNIFORM_PRIOR);

        for (Hypothesis hypothesis : hypotheses) {
            raw.merge(hypothesis.getDebtType(),
                    hypothesis.getPriorProbability() * 0.2 + hypothesis.getConfidence() * 0.3,
                    Double::sum);
        }
        for (ToolObservation observation : observations) {
            observation.getEvidence().forEach((type, score) ->
                    raw.merge(type, score * observation.getConfidence(), Double::sum));
        }

        raw.replaceAll((type, score) -> Math.max(score, 0.0));
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            return List.of();
        }

        return raw.entrySet().stream()
                .map(e -> new RankedDebt(e.getKey(), e.getValue() / total, e.getValue()))
                .sorted(Comparator.comparingDouble(RankedDebt::score).reversed())
                .toList();
    }

    /**
     * Category with its normalized share and the unnormalized accumulated score.
     */
    public record RankedDebt(DebtType type, double score, double rawScore) {
    }
}
