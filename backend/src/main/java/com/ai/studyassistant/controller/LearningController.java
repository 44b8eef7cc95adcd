package com.ai.studyassistant.controller;

import com.ai.studyassistant.dto.AskQuestionRequest;
import com.ai.studyassistant.dto.AskQuestionResponse;
import com.ai.studyassistant.dto.event.StreamEvent;
import com.ai.studyassistant.service.StreamingQaService;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.security.Principal;

/**
 * LearningController exposes the course knowledge Q&amp;A endpoints.
 *
 * <pre>
 *   POST /api/learning/ask-stream   → text/event-stream of StreamEvent records
 *   POST /api/learning/ask          → AskQuestionResponse (non-streaming)
 *   Body: { "question": "What is a binary heap?", "course_id": 12 }
 * </pre>
 *
 * <p>
 * The stream endpoint always answers 200 once validation passes; failures
 * after that are reported inside the stream as an {@code error} record.
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class LearningController {

    private final StreamingQaService qaService;

    /**
     * Streams the answer as Server-Sent Events. Each record is
     * {@code data: <json>} with a {@code type} of metadata, content, done or error.
     *
     * @param request   the question body
     * @param response  used to disable proxy buffering for this stream
     * @param principal the authenticated user, if any
     */
    @PostMapping(value = "/ask-stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamEvent>> askStream(
            @Valid @RequestBody AskQuestionRequest request,
            HttpServletResponse response,
            Principal principal) {

        log.info("Streaming Q&A request: user='{}', courseId={}", userOf(principal), request.getCourseId());

        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate");
        response.setHeader("X-Accel-Buffering", "no"); // disable Nginx buffering

        return qaService.stream(request)
                .map(event -> ServerSentEvent.<StreamEvent>builder(event).build());
    }

    /**
     * Answers without streaming. Same retrieval and attribution as the
     * stream endpoint; errors are mapped by {@code GlobalExceptionHandler}.
     */
    @PostMapping("/ask")
    public ResponseEntity<AskQuestionResponse> ask(
            @Valid @RequestBody AskQuestionRequest request,
            Principal principal) {

        log.info("Q&A request: user='{}', courseId={}", userOf(principal), request.getCourseId());
        return ResponseEntity.ok(qaService.ask(request));
    }

    private static String userOf(Principal principal) {
        return (principal != null) ? principal.getName() : "anonymous";
    }
}
