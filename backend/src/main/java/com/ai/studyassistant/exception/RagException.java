package com.ai.studyassistant.exception;

/**
 * Base class for failures of the question-answering pipeline.
 */
public class RagException extends RuntimeException {

    public RagException(String message) {
        super(message);
    }

    public RagException(String message, Throwable cause) {
        super(message, cause);
    }
}
