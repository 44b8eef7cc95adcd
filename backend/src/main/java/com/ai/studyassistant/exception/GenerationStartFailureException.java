package com.ai.studyassistant.exception;

/**
 * The model call failed before producing any output. Nothing has reached the
 * client yet, so the request can still be answered synchronously.
 */
public class GenerationStartFailureException extends RagException {

    public GenerationStartFailureException(String message) {
        super(message);
    }

    public GenerationStartFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
