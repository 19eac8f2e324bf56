package com.phonepe.tutorai.core.model;

import lombok.NonNull;

/**
 * A role/content pair ready to be handed to a chat completion call
 */
public record ContextMessage(@NonNull Role role, @NonNull String content) {

    public static ContextMessage system(final String content) {
        return new ContextMessage(Role.SYSTEM, content);
    }

    public static ContextMessage of(final Message message) {
        return new ContextMessage(message.getRole(), message.getContent());
    }
}
