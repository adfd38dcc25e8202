package com.vita.causality.narrative;

import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.ToolObservation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates for narrative generation.
 */
public final class PromptTemplates {

    static final String CHAIN_SEPARATOR = " -> ";

    private static final String SYSTEM_PROMPT = "You are a supportive friend who understands health data. "
            + "Stay strictly within the provided evidence. "
            + "Do not add conditions, diseases, or medical advice not present in the input. "
            + "Never use clinical jargon. Speak like a knowledgeable peer, not a doctor. "
            + "Be warm but specific and always reference the actual numbers and foods from the data.";

    private PromptTemplates() {
    }

    /**
     * Three-sentence narrative prompt: why, evidence, fix.
     */
    public static String peerNarrativePrompt(String symptom, Hypothesis hypothesis, List<ToolObservation> observations) {
        String evidence = observations.stream()
                .map(ToolObservation::getDetail)
                .filter(detail -> !detail.isEmpty())
                .collect(Collectors.joining("; "));

        return "<|system|>\n" + SYSTEM_PROMPT + "\n<|end|>\n"
                + "<|user|>\n"
                + "Explain why I'm experiencing \"" + symptom + "\" in exactly 3 sentences:\n"
                + "1. WHY: What caused it (use the cause below)\n"
                + "2. EVIDENCE: How the data shows the connection (use the numbers below)\n"
                + "3. FIX: One easy thing I could try next time (frame as a choice, not a command)\n\n"
                + "Primary cause: " + hypothesis.getDescription() + "\n"
                + "Cause type: " + hypothesis.getDebtType().label() + "\n"
                + "Confidence: " + (int) (hypothesis.getConfidence() * 100) + "%\n"
                + "Causal chain: " + String.join(CHAIN_SEPARATOR, hypothesis.getCausalChain()) + "\n"
                + "Evidence: " + evidence + "\n"
                + "<|end|>\n"
                + "<|assistant|>\n";
    }
}
