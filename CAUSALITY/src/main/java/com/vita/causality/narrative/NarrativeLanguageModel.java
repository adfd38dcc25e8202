package com.vita.causality.narrative;

import reactor.core.publisher.Mono;

/**
 * Optional text-generation backend for explanation narratives.
 * No implementation is registered by default; when none is present narratives come from templates.
 */
public interface NarrativeLanguageModel {

    /**
     * Complete a prompt.
     *
     * @param prompt the full prompt
     * @param maxTokens upper bound on generated tokens
     * @return the generated text
     */
    Mono<String> generate(String prompt, int maxTokens);

    /**
     * Whether the model is loaded and can serve requests.
     */
    boolean isReady();
}
