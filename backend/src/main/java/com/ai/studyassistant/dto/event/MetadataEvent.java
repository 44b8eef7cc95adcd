package com.ai.studyassistant.dto.event;

import com.ai.studyassistant.dto.SourceDto;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Sent before any content so the client can render source chips while the
 * answer is still generating. Sources are the passages placed in the prompt.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({ "type", "sources", "has_context" })
public final class MetadataEvent extends StreamEvent {

    private final List<SourceDto> sources;

    @JsonProperty("has_context")
    private final boolean hasContext;

    MetadataEvent(List<SourceDto> sources, boolean hasContext) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.hasContext = hasContext;
    }

    @Override
    public StreamEventType getType() {
        return StreamEventType.METADATA;
    }
}
