package com.phonepe.tutorai.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Author of a message in a tutoring conversation
 */
@Getter
@AllArgsConstructor
public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    ;

    @JsonValue
    private final String wireName;

    /**
     * Title-cased label used when rendering a transcript, e.g. "User"
     */
    public String label() {
        return Character.toUpperCase(wireName.charAt(0)) + wireName.substring(1);
    }
}
