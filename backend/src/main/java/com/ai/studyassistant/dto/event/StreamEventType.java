package com.ai.studyassistant.dto.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator written as the {@code type} field of every stream record.
 */
public enum StreamEventType {
    METADATA("metadata"),
    CONTENT("content"),
    DONE("done"),
    ERROR("error");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
