package com.phonepe.tutorai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One utterance in a session. The token count is computed once when the message is created.
 */
@Value
public class Message {
    @JsonProperty("role")
    Role role;

    @JsonProperty("content")
    String content;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("token_count")
    int tokenCount;

    @Builder
    @JsonCreator
    public Message(@JsonProperty("role") @NonNull Role role,
                   @JsonProperty("content") @NonNull String content,
                   @JsonProperty("timestamp") @NonNull Instant timestamp,
                   @JsonProperty("token_count") int tokenCount) {
        Preconditions.checkArgument(tokenCount >= 0, "Token count cannot be negative: %s", tokenCount);
        this.role = role;
        this.content = content;
        this.timestamp = timestamp;
        this.tokenCount = tokenCount;
    }
}
