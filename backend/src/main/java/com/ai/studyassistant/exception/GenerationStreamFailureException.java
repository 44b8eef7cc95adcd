package com.ai.studyassistant.exception;

/**
 * The model stream broke after fragments were already delivered. Too late to
 * fall back; the answer must be reported as aborted.
 */
public class GenerationStreamFailureException extends RagException {

    public GenerationStreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
