package com.vita.causality.narrative;

import com.vita.causality.config.CausalityProperties;
import com.vita.causality.domain.model.Hypothesis;
import com.vita.causality.domain.model.ToolObservation;
import com.vita.causality.observability.CausalityMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Produces the user-facing narrative for an explanation.
 * <p>
 * Tries the language model when one is registered, enabled and allowed by the maturity phase.
 * Output that does not mention the symptom or a causal-chain term is rejected, and any
 * failure falls back to a template.
 */
@Slf4j
@Component
public class NarrativeGenerator {

    private static final int MIN_TERM_LENGTH = 4;

    private final Optional<NarrativeLanguageModel> languageModel;
    private final CausalityProperties properties;
    private final CausalityMetrics metrics;

    @Autowired
    public NarrativeGenerator(ObjectProvider<NarrativeLanguageModel> languageModel,
                              CausalityProperties properties,
                              CausalityMetrics metrics) {
        this(Optional.ofNullable(languageModel.getIfAvailable()), properties, metrics);
    }

    NarrativeGenerator(Optional<NarrativeLanguageModel> languageModel,
                       CausalityProperties properties,
                       CausalityMetrics metrics) {
        this.languageModel = languageModel;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Generate a narrative; never errors.
     *
     * @param useLanguageModel whether the current maturity phase permits model output
     */
    public Mono<String> generate(String symptom, Hypothesis hypothesis, List<ToolObservation> observations,
                                 boolean useLanguageModel) {
        String template = generateTemplate(symptom, hypothesis, observations);

        CausalityProperties.Narrative config = properties.getNarrative();
        if (!useLanguageModel || !config.isLlmEnabled()
                || languageModel.isEmpty() || !languageModel.get().isReady()) {
            metrics.recordNarrative(false);
            return Mono.just(template);
        }

        String prompt = PromptTemplates.peerNarrativePrompt(symptom, hypothesis, observations);
        return languageModel.get().generate(prompt, config.getMaxTokens())
                .timeout(config.getTimeout())
                .map(String::trim)
                .filter(output -> !output.isEmpty() && isGrounded(output, symptom, hypothesis.getCausalChain()))
                .doOnNext(output -> metrics.recordNarrative(true))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Language model output rejected as ungrounded, using template");
                    metrics.recordNarrative(false);
                    return template;
                }))
                .onErrorResume(e -> {
                    log.warn("Language model narrative failed, using template: {}", e.getMessage());
                    metrics.recordNarrative(false);
                    return Mono.just(template);
                });
    }

    /**
     * Output is grounded when it mentions any causal-chain term or symptom word longer than three characters.
     */
    static boolean isGrounded(String output, String symptom, List<String> causalChain) {
        String lowered = output.toLowerCase(Locale.ROOT);
        return Stream.concat(causalChain.stream(), Stream.of(symptom))
                .flatMap(text -> Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")))
                .filter(term -> term.length() >= MIN_TERM_LENGTH)
                .anyMatch(lowered::contains);
    }

    public String generateTemplate(String symptom, Hypothesis hypothesis, List<ToolObservation> observations) {
        int confidence = (int) (hypothesis.getConfidence() * 100);
        String chain = String.join(PromptTemplates.CHAIN_SEPARATOR, hypothesis.getCausalChain());
        Optional<String> detail = observations.stream()
                .map(ToolObservation::getDetail)
                .filter(d -> !d.isEmpty())
                .findFirst();
        String lowered = symptom.toLowerCase(Locale.ROOT);

        String why;
        String evidence;
        String fix;
        switch (hypothesis.getDebtType()) {
            case METABOLIC -> {
                why = "Looks like your " + lowered + " is connected to what you ate recently";
                evidence = detail
                        .map(d -> "Here's what the data shows (" + confidence + "% confidence): " + d + ".")
                        .orElse("Your glucose and meal data point to a metabolic pattern (" + confidence
                                + "% confidence): " + chain + ".");
                fix = "A short walk after your next meal could help smooth things out.";
            }
            case DIGITAL -> {
                why = "Your " + lowered + " seems tied to your screen time patterns";
                evidence = detail
                        .map(d -> "The data shows (" + confidence + "% confidence): " + d + ".")
                        .orElse("Extended passive screen time has been building up attention fatigue ("
                                + confidence + "% confidence): " + chain + ".");
                fix = "Taking a quick break from screens when you notice the pull might help.";
            }
            default -> {
                why = "Your " + lowered + " looks like it has roots in your environment or recovery";
                evidence = detail
                        .map(d -> "Here's what stands out (" + confidence + "% confidence): " + d + ".")
                        .orElse("Sleep and environmental factors are playing a role (" + confidence
                                + "% confidence): " + chain + ".");
                fix = "Getting some extra rest could make a real difference.";
            }
        }
        return why + ". " + evidence + " " + fix;
    }
}
