package com.ai.studyassistant.dto.event;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** An answer fragment; clients append it verbatim. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({ "type", "content" })
public final class ContentEvent extends StreamEvent {

    private final String content;

    ContentEvent(String content) {
        this.content = content;
    }

    @Override
    public StreamEventType getType() {
        return StreamEventType.CONTENT;
    }
}
