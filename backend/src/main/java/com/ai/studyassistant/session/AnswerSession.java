package com.ai.studyassistant.session;

import com.ai.studyassistant.dto.event.StreamEvent;
import com.ai.studyassistant.dto.event.StreamEventType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Per-request state of one question → answer interaction.
 *
 * <p>
 * Owned by a single request and never shared between requests. Methods are
 * synchronized because reactive callbacks (fragment delivery, timeouts,
 * client cancellation) may arrive on different threads.
 * </p>
 *
 * <p>
 * {@link #record} enforces the stream ordering: one metadata record first,
 * then content, then exactly one terminal record. {@link #hasEmittedContent()}
 * is the flag that decides between silent fallback and a visible error.
 * </p>
 */
@Slf4j
public class AnswerSession {

    @Getter
    private final String id;

    @Getter
    private final long startedAtMillis;

    private SessionState state = SessionState.IDLE;
    private boolean metadataEmitted;
    private int contentEvents;
    private boolean terminated;
    private boolean cancelled;

    AnswerSession(String id) {
        this.id = id;
        this.startedAtMillis = System.currentTimeMillis();
    }

    public static AnswerSession start() {
        return new AnswerSession("sess_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    public synchronized SessionState getState() {
        return state;
    }

    /**
     * Moves to {@code next}. Late transitions on a cancelled session are
     * ignored because the consumer is already gone.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transitionTo(SessionState next) {
        if (cancelled) {
            log.debug("[{}] Ignoring {} -> {} after cancellation", id, state, next);
            return;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next);
        }
        log.debug("[{}] {} -> {}", id, state, next);
        state = next;
    }

    /** Marks the session failed unless it already ended. */
    public synchronized void fail() {
        if (!state.isTerminal()) {
            log.debug("[{}] {} -> {}", id, state, SessionState.FAILED);
            state = SessionState.FAILED;
        }
    }

    /**
     * Called for every record handed to the client, in order.
     *
     * @throws IllegalStateException if the record would break the stream ordering
     */
    public synchronized void record(StreamEvent event) {
        StreamEventType type = event.getType();
        if (terminated) {
            throw new IllegalStateException("Record " + type + " after the terminal record");
        }
        switch (type) {
            case METADATA -> {
                if (metadataEmitted) {
                    throw new IllegalStateException("Metadata already sent");
                }
                metadataEmitted = true;
            }
            case CONTENT -> {
                requireMetadata(type);
                contentEvents++;
            }
            case DONE, ERROR -> {
                requireMetadata(type);
                terminated = true;
            }
        }
    }

    public synchronized boolean hasEmittedMetadata() {
        return metadataEmitted;
    }

    public synchronized boolean hasEmittedContent() {
        return contentEvents > 0;
    }

    public synchronized int getContentEvents() {
        return contentEvents;
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    /**
     * The consumer went away.
     *
     * @return {@code true} if the session was still live
     */
    public synchronized boolean cancel() {
        if (terminated || state.isTerminal() || cancelled) {
            return false;
        }
        state = SessionState.FAILED;
        cancelled = true;
        return true;
    }

    public long elapsedMillis() {
        return System.currentTimeMillis() - startedAtMillis;
    }

    private void requireMetadata(StreamEventType type) {
        if (!metadataEmitted) {
            throw new IllegalStateException("Record " + type + " before metadata");
        }
    }
}
