package dev.jobscout.ai;

import reactor.core.publisher.Mono;

/**
 * Text-generation backend used to score posting batches.
 * Implementations retry transient failures themselves and never emit an error:
 * a failed call completes empty.
 */
public interface ScoringClient {

    /** HTTP attempts per call, the first one included. */
    int MAX_ATTEMPTS = 3;

    /**
     * Send one prompt and return the raw completion text.
     *
     * @param prompt the full scoring prompt
     * @return Mono with the completion, or empty when the call failed
     */
    Mono<String> complete(String prompt);

    /**
     * Check if the backend is configured.
     *
     * @return true if calls can be made
     */
    boolean isEnabled();

    String getName();
}
