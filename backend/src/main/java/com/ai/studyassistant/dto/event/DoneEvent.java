package com.ai.studyassistant.dto.event;

import com.ai.studyassistant.dto.SourceDto;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * The answer is complete. {@code sources} lists only the passages the answer
 * was found to use, and may be empty.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({ "type", "sources" })
public final class DoneEvent extends StreamEvent {

    private final List<SourceDto> sources;

    DoneEvent(List<SourceDto> sources) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @Override
    public StreamEventType getType() {
        return StreamEventType.DONE;
    }
}
