package com.ai.studyassistant.service;

import com.ai.studyassistant.client.GenerationClient;
import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.exception.GenerationStartFailureException;
import com.ai.studyassistant.exception.GenerationStreamFailureException;
import com.ai.studyassistant.exception.RagException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GenerationStreamAdapter wraps the model call as a lazy, single-use
 * {@link Flux} of text fragments.
 *
 * <h3>Failure classification</h3>
 * <ul>
 * <li>No fragment yet (call rejected, connection reset, first-fragment timeout,
 * empty output): {@link GenerationStartFailureException}. The caller may
 * still fall back to {@link #generateSync}.</li>
 * <li>At least one fragment delivered: {@link GenerationStreamFailureException}.</li>
 * </ul>
 *
 * <h3>Timeouts</h3>
 * The first fragment must arrive within {@code rag.generation.first-fragment-timeout};
 * after that every fragment, and completion, must arrive before the overall
 * {@code rag.generation.timeout} deadline.
 *
 * <h3>Cancellation</h3>
 * Cancelling the returned Flux cancels the upstream model stream, which
 * closes the HTTP connection to the model. No fragment is emitted afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationStreamAdapter {

    private final GenerationClient generationClient;
    private final RagProperties properties;

    /**
     * @param prompt the rendered prompt
     * @return a finite, non-restartable sequence of non-empty fragments
     */
    public Flux<String> generate(String prompt) {
        AtomicBoolean consumed = new AtomicBoolean();
        return Flux.defer(() -> {
            if (!consumed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Generation stream can only be consumed once"));
            }
            return open(prompt);
        });
    }

    /**
     * Non-streaming call for the same prompt, bounded by
     * {@code rag.generation.sync-timeout}. Blank answers count as failures.
     */
    public Mono<String> generateSync(String prompt) {
        RagProperties.Generation generation = properties.getGeneration();
        return Mono.fromCallable(() -> generationClient.call(prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(generation.getSyncTimeout())
                .filter(answer -> !answer.isBlank())
                .switchIfEmpty(Mono.error(() -> new GenerationStartFailureException("Model returned an empty answer")))
                .onErrorMap(e -> !(e instanceof RagException),
                        e -> new GenerationStartFailureException("Synchronous generation failed: " + describe(e), e));
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private Flux<String> open(String prompt) {
        RagProperties.Generation generation = properties.getGeneration();
        long deadline = System.nanoTime() + generation.getTimeout().toNanos();
        AtomicBoolean started = new AtomicBoolean();

        return Flux.defer(() -> generationClient.stream(prompt))
                .filter(fragment -> fragment != null && !fragment.isEmpty())
                .timeout(Mono.delay(generation.getFirstFragmentTimeout()),
                        fragment -> Mono.delay(remaining(deadline)))
                .doOnNext(fragment -> started.set(true))
                .switchIfEmpty(Flux.error(() -> new GenerationStartFailureException("Model stream ended without output")))
                .onErrorMap(e -> !(e instanceof RagException), e -> classify(e, started.get()))
                .doOnCancel(() -> log.info("Generation cancelled by consumer; upstream model stream released"));
    }

    private static RagException classify(Throwable error, boolean started) {
        if (!started) {
            String reason = error instanceof TimeoutException ? "no output before first-fragment timeout" : describe(error);
            return new GenerationStartFailureException("Model stream failed to start: " + reason, error);
        }
        String reason = error instanceof TimeoutException ? "generation deadline exceeded" : describe(error);
        return new GenerationStreamFailureException("Model stream failed mid-answer: " + reason, error);
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
