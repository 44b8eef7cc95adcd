package com.ai.studyassistant.service;

import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.dto.AskQuestionRequest;
import com.ai.studyassistant.dto.AskQuestionResponse;
import com.ai.studyassistant.dto.SourceDto;
import com.ai.studyassistant.dto.event.StreamEvent;
import com.ai.studyassistant.exception.RetrievalUnavailableException;
import com.ai.studyassistant.model.PromptContext;
import com.ai.studyassistant.model.RetrievalResult;
import com.ai.studyassistant.session.AnswerSession;
import com.ai.studyassistant.session.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * StreamingQaService runs one question through retrieval, prompt composition,
 * generation and attribution, and reports progress as a typed event stream.
 *
 * <h2>Request lifecycle</h2>
 * <pre>
 *  question ─► embed + Retriever ─► PromptComposer ─► metadata
 *                 (index down ⇒ no context)              │
 *                                                        ▼
 *                       GenerationStreamAdapter ─► content, content, ...
 *                                                        │
 *                          AttributionTracker ─► done{sources}
 * </pre>
 *
 * <h2>Degradation policy</h2>
 * <ul>
 * <li>Retrieval failure or timeout: answer without course material.</li>
 * <li>Composition failure: general-knowledge prompt, answered synchronously.</li>
 * <li>Generation fails before any content was sent: answer synchronously and
 * send the whole answer as one content record.</li>
 * <li>Generation fails after content was sent: terminal {@code error}.</li>
 * </ul>
 *
 * Sessions share nothing mutable; each request gets its own {@link AnswerSession}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingQaService {

    static final String ABORTED_MESSAGE =
            "The answer was interrupted before it could be completed. Please ask again.";
    static final String UNAVAILABLE_MESSAGE =
            "The assistant is unable to answer right now. Please try again later.";

    private final EmbeddingModel embeddingModel;
    private final Retriever retriever;
    private final PromptComposer promptComposer;
    private final GenerationStreamAdapter generationAdapter;
    private final AttributionTracker attributionTracker;
    private final RagProperties properties;

    // ── Public API ──────────────────────────────────────────────────────────

    /**
     * Answers {@code request} as a stream: one metadata record, content
     * fragments in generation order, then exactly one {@code done} or
     * {@code error}. The returned Flux never errors.
     */
    public Flux<StreamEvent> stream(AskQuestionRequest request) {
        return Flux.defer(() -> {
            AnswerSession session = AnswerSession.start();
            log.info("[{}] Streaming question: courseId={}, question='{}'",
                    session.getId(), request.getCourseId(), abbreviate(request.getQuestion()));

            return prepare(session, request)
                    .flatMapMany(context -> Flux.concat(
                            Mono.fromSupplier(() -> metadata(context)),
                            Flux.defer(() -> respond(session, context))))
                    .onErrorResume(error -> abort(session, error))
                    .doOnNext(session::record)
                    .doOnCancel(() -> {
                        if (session.cancel()) {
                            log.info("[{}] Client disconnected after {} content events; generation stopped",
                                    session.getId(), session.getContentEvents());
                        }
                    });
        });
    }

    /**
     * Answers {@code request} without streaming. Runs the same retrieval,
     * composition and attribution as {@link #stream}.
     */
    public AskQuestionResponse ask(AskQuestionRequest request) {
        AnswerSession session = AnswerSession.start();
        log.info("[{}] Synchronous question: courseId={}, question='{}'",
                session.getId(), request.getCourseId(), abbreviate(request.getQuestion()));
        try {
            PromptContext context = prepare(session, request).block();
            if (session.getState() != SessionState.FALLBACK_SYNCHRONOUS) {
                session.transitionTo(SessionState.FALLBACK_SYNCHRONOUS);
            }
            String answer = generationAdapter.generateSync(context.getRenderedPrompt()).block();
            List<RetrievalResult> used = attributionTracker.finalizeSources(context, answer);
            session.transitionTo(SessionState.COMPLETED);

            log.info("[{}] Answered synchronously in {}ms, sources={}",
                    session.getId(), session.elapsedMillis(), used.size());
            return AskQuestionResponse.builder()
                    .answer(answer)
                    .sources(toSources(used))
                    .confidence(confidence(context))
                    .build();
        } catch (RuntimeException e) {
            session.fail();
            throw e;
        }
    }

    // ── Retrieving → Composing ──────────────────────────────────────────────

    private Mono<PromptContext> prepare(AnswerSession session, AskQuestionRequest request) {
        RagProperties.Retrieval retrieval = properties.getRetrieval();

        Mono<List<RetrievalResult>> results = Mono.defer(() -> {
            session.transitionTo(SessionState.RETRIEVING);
            return Mono.fromCallable(() -> retrieve(request))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(retrieval.getTimeout());
        }).onErrorResume(error -> {
            log.warn("[{}] Retrieval unavailable, answering without course material: {}",
                    session.getId(), error.toString());
            return Mono.just(List.of());
        });

        return results.flatMap(found -> Mono.defer(() -> {
            session.transitionTo(SessionState.COMPOSING);
            log.debug("[{}] Retrieved {} chunks", session.getId(), found.size());
            return Mono.fromCallable(() -> promptComposer.compose(request.getQuestion(), found,
                            request.getHistory(), properties.getPrompt().getBudgetChars()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(properties.getPrompt().getTimeout());
        }).onErrorResume(error -> {
            log.warn("[{}] Prompt composition failed, using a general-knowledge prompt: {}",
                    session.getId(), error.toString());
            session.transitionTo(SessionState.FALLBACK_SYNCHRONOUS);
            return Mono.fromCallable(() -> promptComposer.composeGeneralKnowledge(
                    request.getQuestion(), properties.getPrompt().getBudgetChars()));
        }));
    }

    private List<RetrievalResult> retrieve(AskQuestionRequest request) {
        RagProperties.Retrieval retrieval = properties.getRetrieval();
        float[] embedding;
        try {
            embedding = embeddingModel.embed(request.getQuestion());
        } catch (RuntimeException e) {
            throw new RetrievalUnavailableException("Embedding service unavailable: " + e.getMessage(), e);
        }
        return retriever.retrieve(embedding, retrieval.getTopK(), retrieval.getMinSimilarity(),
                request.getCourseId());
    }

    // ── Streaming → Finalizing ──────────────────────────────────────────────

    private Flux<StreamEvent> respond(AnswerSession session, PromptContext context) {
        if (session.getState() == SessionState.FALLBACK_SYNCHRONOUS) {
            return fallback(session, context);
        }
        session.transitionTo(SessionState.STREAMING);

        StringBuilder answer = new StringBuilder();
        return generationAdapter.generate(context.getRenderedPrompt())
                .doOnNext(answer::append)
                .<StreamEvent>map(StreamEvent::content)
                .concatWith(Mono.fromSupplier(() -> complete(session, context, answer.toString())))
                .onErrorResume(error -> onGenerationFailure(session, context, error));
    }

    /**
     * The single place where a generation failure is judged: before the first
     * content record it is recovered synchronously, afterwards it is surfaced.
     */
    private Flux<StreamEvent> onGenerationFailure(AnswerSession session, PromptContext context, Throwable error) {
        if (!session.hasEmittedContent()) {
            log.warn("[{}] Streaming failed before any content ({}); retrying synchronously",
                    session.getId(), error.getMessage());
            session.transitionTo(SessionState.FALLBACK_SYNCHRONOUS);
            return fallback(session, context);
        }
        log.error("[{}] Streaming failed after {} content events: {}",
                session.getId(), session.getContentEvents(), error.getMessage(), error);
        session.fail();
        return Flux.just(StreamEvent.error(ABORTED_MESSAGE));
    }

    private StreamEvent complete(AnswerSession session, PromptContext context, String answer) {
        session.transitionTo(SessionState.FINALIZING);
        List<RetrievalResult> used = attributionTracker.finalizeSources(context, answer);
        session.transitionTo(SessionState.COMPLETED);
        log.info("[{}] Streamed answer complete in {}ms: contentEvents={}, length={}, sources={}/{}",
                session.getId(), session.elapsedMillis(), session.getContentEvents(), answer.length(),
                used.size(), context.getSelectedChunks().size());
        return StreamEvent.done(toSources(used));
    }

    // ── FallbackSynchronous ─────────────────────────────────────────────────

    private Flux<StreamEvent> fallback(AnswerSession session, PromptContext context) {
        return generationAdapter.generateSync(context.getRenderedPrompt())
                .flatMapMany(answer -> {
                    List<RetrievalResult> used = attributionTracker.finalizeSources(context, answer);
                    session.transitionTo(SessionState.COMPLETED);
                    log.info("[{}] Answered via synchronous fallback in {}ms, sources={}",
                            session.getId(), session.elapsedMillis(), used.size());
                    return Flux.<StreamEvent>just(StreamEvent.content(answer), StreamEvent.done(toSources(used)));
                })
                .onErrorResume(error -> {
                    log.error("[{}] Synchronous fallback failed: {}", session.getId(), error.getMessage(), error);
                    session.fail();
                    return Flux.just(StreamEvent.error(UNAVAILABLE_MESSAGE));
                });
    }

    private Flux<StreamEvent> abort(AnswerSession session, Throwable error) {
        log.error("[{}] Session aborted in state {}: {}", session.getId(), session.getState(),
                error.getMessage(), error);
        session.fail();
        if (session.isTerminated()) {
            return Flux.empty();
        }
        List<StreamEvent> events = new ArrayList<>();
        if (!session.hasEmittedMetadata()) {
            events.add(StreamEvent.metadata(List.of(), false));
        }
        events.add(StreamEvent.error(session.hasEmittedContent() ? ABORTED_MESSAGE : UNAVAILABLE_MESSAGE));
        return Flux.fromIterable(events);
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private StreamEvent metadata(PromptContext context) {
        return StreamEvent.metadata(toSources(context.getSelectedChunks()), context.hasContext());
    }

    private List<SourceDto> toSources(List<RetrievalResult> results) {
        int snippetLength = properties.getSources().getSnippetLength();
        return results.stream()
                .map(result -> SourceDto.from(result, snippetLength))
                .toList();
    }

    /** Best similarity among the top three composed chunks, or null without context. */
    private static Double confidence(PromptContext context) {
        OptionalDouble best = context.getSelectedChunks().stream()
                .limit(3)
                .mapToDouble(RetrievalResult::getSimilarityScore)
                .max();
        return best.isPresent() ? best.getAsDouble() : null;
    }

    private static String abbreviate(String question) {
        return question.length() <= 80 ? question : question.substring(0, 80) + "...";
    }
}
