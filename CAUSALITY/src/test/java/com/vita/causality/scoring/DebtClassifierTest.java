package com.vita.causality.scoring;

import com.vita.causality.domain.model.DebtType;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.scoring.DebtClassifier.RankedDebt;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DebtClassifierTest {

    private final DebtClassifier classifier = new DebtClassifier();

    @Test
    void uniformPriorWithoutEvidence() {
        List<RankedDebt> ranked = classifier.classify(List.of(), List.of());

        assertThat(ranked).extracting(RankedDebt::type).first().isEqualTo(DebtType.SOMATIC);
        assertThat(ranked.stream().mapToDouble(RankedDebt::score).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void negativeEvidenceIsFlooredAtZero() {
        Hypothesis metabolic = Hypothesis.builder()
                .debtType(DebtType.METABOLIC)
                .description("Glucose crash")
                .confidence(0.8)
                .priorProbability(0.5)
                .build();
        ToolObservation observation = ToolObservation.builder()
                .toolName("MetabolicScanner")
                .evidence(Map.of(DebtType.DIGITAL, -1.0))
                .confidence(1.0)
                .build();

        List<RankedDebt> ranked = classifier.classify(List.of(metabolic), List.of(observation));

        assertThat(ranked.get(0).type()).isEqualTo(DebtType.METABOLIC);
        assertThat(ranked.get(0).rawScore()).isCloseTo(0.67, within(1e-9));
        assertThat(ranked.get(0).score()).isCloseTo(0.67 / 1.01, within(1e-9));
        assertThat(ranked).filteredOn(r -> r.type() == DebtType.DIGITAL)
                .singleElement()
                .satisfies(digital -> assertThat(digital.score()).isZero());
    }

    @Test
    void observationsAreWeightedByToolConfidence() {
        ToolObservation strong = ToolObservation.builder()
                .toolName("DigitalFrictionAnalyzer")
                .evidence(Map.of(DebtType.DIGITAL, 1.0))
                .confidence(0.5)
                .build();

        List<RankedDebt> ranked = classifier.classify(List.of(), List.of(strong));

        assertThat(ranked.get(0).type()).isEqualTo(DebtType.DIGITAL);
        assertThat(ranked.get(0).rawScore()).isCloseTo(0.83, within(1e-9));
    }
}
