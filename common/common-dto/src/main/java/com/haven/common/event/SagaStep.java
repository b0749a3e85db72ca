package com.haven.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Local steps of the account-deletion saga, one per participating service.
 * Serialized in lower case ("chat", "community", "auth").
 */
public enum SagaStep {
    AUTH,
    COMMUNITY,
    CHAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SagaStep fromWireName(String value) {
        return Arrays.stream(values())
                .filter(step -> step.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown saga step: " + value));
    }
}
