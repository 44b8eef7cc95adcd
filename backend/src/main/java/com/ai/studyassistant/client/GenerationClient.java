package com.ai.studyassistant.client;

import reactor.core.publisher.Flux;

/**
 * The underlying text-generation model, seen as a black box.
 *
 * <p>
 * Implementations must tie {@link #stream} to the upstream call so that
 * cancelling the returned {@link Flux} releases the model connection.
 * </p>
 */
public interface GenerationClient {

    /** Streams the answer to {@code prompt} as text fragments in generation order. */
    Flux<String> stream(String prompt);

    /** Blocking, non-streaming call for the same prompt. */
    String call(String prompt);
}
