package com.ai.studyassistant.session;

/**
 * Lifecycle of one answer session.
 *
 * <pre>
 * IDLE → RETRIEVING → COMPOSING → STREAMING → FINALIZING → COMPLETED | FAILED
 *                 └──────────┴───────────┴──→ FALLBACK_SYNCHRONOUS → COMPLETED | FAILED
 * </pre>
 *
 * Any live state may also move to FAILED (unrecoverable error or client gone).
 */
public enum SessionState {
    IDLE,
    RETRIEVING,
    COMPOSING,
    STREAMING,
    FINALIZING,
    FALLBACK_SYNCHRONOUS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(SessionState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case IDLE -> next == RETRIEVING;
            case RETRIEVING -> next == COMPOSING || next == FALLBACK_SYNCHRONOUS;
            case COMPOSING -> next == STREAMING || next == FALLBACK_SYNCHRONOUS;
            case STREAMING -> next == FINALIZING || next == FALLBACK_SYNCHRONOUS;
            case FINALIZING, FALLBACK_SYNCHRONOUS -> next == COMPLETED;
            case COMPLETED, FAILED -> false;
        };
    }
}
