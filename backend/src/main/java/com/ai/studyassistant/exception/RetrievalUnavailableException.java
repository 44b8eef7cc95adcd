package com.ai.studyassistant.exception;

/**
 * The knowledge index (or the embedding service in front of it) could not be
 * reached. Callers degrade to answering without course material.
 */
public class RetrievalUnavailableException extends RagException {

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
