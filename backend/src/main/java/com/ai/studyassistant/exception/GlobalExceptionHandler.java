package com.ai.studyassistant.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * GlobalExceptionHandler provides centralized exception handling across all
 * controllers, ensuring consistent error responses are returned to the client.
 *
 * <p>
 * Only failures raised before a response starts land here. Once an answer
 * stream is open, failures travel inside it as {@code error} records.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles bean-validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        log.warn("Rejected invalid request: {}", message);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, message, "INVALID_REQUEST");
    }

    /**
     * Handles malformed JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Request body is not valid JSON.", "INVALID_REQUEST");
    }

    /**
     * The question (plus instructions) is too long to fit any prompt.
     */
    @ExceptionHandler(PromptBudgetExceededException.class)
    public ResponseEntity<Map<String, Object>> handlePromptBudget(PromptBudgetExceededException ex) {
        log.warn("Prompt budget exceeded: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST,
                "Your question is too long. Please shorten it and try again.", "QUESTION_TOO_LONG");
    }

    /**
     * Handles model failures on the non-streaming endpoint.
     */
    @ExceptionHandler({ GenerationStartFailureException.class, GenerationStreamFailureException.class })
    public ResponseEntity<Map<String, Object>> handleGenerationFailure(RagException ex) {
        log.error("AI generation failed: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "The AI service could not answer right now. Please try again.", "AI_SERVICE_UNAVAILABLE");
    }

    /**
     * The client closed an answer stream; there is nobody left to respond to.
     */
    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleClientGone(AsyncRequestNotUsableException ex) {
        log.debug("Client connection no longer usable: {}", ex.getMessage());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.",
                "INTERNAL_SERVER_ERROR"
        );
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "errorCode", errorCode,
                "status", status.value(),
                "timestamp", LocalDateTime.now().toString()
        ));
    }
}
