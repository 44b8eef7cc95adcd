package com.ai.studyassistant.dto.event;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** The answer was aborted. Never followed by another record. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonPropertyOrder({ "type", "error" })
public final class ErrorEvent extends StreamEvent {

    private final String error;

    ErrorEvent(String error) {
        this.error = error;
    }

    @Override
    public StreamEventType getType() {
        return StreamEventType.ERROR;
    }
}
