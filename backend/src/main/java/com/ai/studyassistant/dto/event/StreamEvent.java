package com.ai.studyassistant.dto.event;

import com.ai.studyassistant.dto.SourceDto;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One record of the answer stream, written to the client as
 * {@code data: <json>} followed by a blank line.
 *
 * <pre>
 * ┌──────────┬──────────────────────────────┬────────────────────────────────┐
 * │ type     │ Payload fields               │ When                           │
 * ├──────────┼──────────────────────────────┼────────────────────────────────┤
 * │ metadata │ sources, has_context         │ exactly once, first            │
 * │ content  │ content (text fragment)      │ zero or more, in order         │
 * │ done     │ sources (extension, below)   │ terminal success               │
 * │ error    │ error (user-facing message)  │ terminal failure               │
 * └──────────┴──────────────────────────────┴────────────────────────────────┘
 * </pre>
 *
 * Exactly one terminal record ends every stream.
 *
 * <p>
 * The base protocol defines {@code done} as an empty record. {@code sources}
 * on it is an extension: clients that ignore unknown fields keep working, and
 * clients that read it get the narrowed source list without a second request.
 * </p>
 */
public abstract class StreamEvent {

    StreamEvent() {
    }

    @JsonProperty("type")
    public abstract StreamEventType getType();

    // ── Static factory methods ────────────────────────────────────────────

    public static MetadataEvent metadata(List<SourceDto> sources, boolean hasContext) {
        return new MetadataEvent(sources, hasContext);
    }

    public static ContentEvent content(String fragment) {
        return new ContentEvent(fragment);
    }

    public static DoneEvent done(List<SourceDto> sources) {
        return new DoneEvent(sources);
    }

    public static ErrorEvent error(String message) {
        return new ErrorEvent(message);
    }
}
