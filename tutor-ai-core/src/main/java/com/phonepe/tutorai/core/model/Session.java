/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.tutorai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversation state for one student and subject.
 * <p>
 * Sessions are immutable. Appending a message or compacting older turns produces a new copy which is written back to
 * the store as a whole, so {@link #getTotalTokens()} and {@link #getMessages()} can never diverge in storage.
 */
@Value
public class Session {
    @JsonProperty("session_id")
    String sessionId;

    @JsonProperty("student_id")
    String studentId;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_activity")
    Instant lastActivity;

    @JsonProperty("total_tokens")
    int totalTokens;

    /**
     * Digest of every message that was compacted out of {@link #messages}. Null until the first compression.
     */
    @JsonProperty("compressed_context")
    String compressedContext;

    @JsonProperty("messages")
    List<Message> messages;

    @Builder(toBuilder = true)
    @JsonCreator
    public Session(@JsonProperty("session_id") @NonNull String sessionId,
                   @JsonProperty("student_id") String studentId,
                   @JsonProperty("subject") String subject,
                   @JsonProperty("created_at") @NonNull Instant createdAt,
                   @JsonProperty("last_activity") Instant lastActivity,
                   @JsonProperty("total_tokens") int totalTokens,
                   @JsonProperty("compressed_context") String compressedContext,
                   @JsonProperty("messages") List<Message> messages) {
        Preconditions.checkArgument(totalTokens >= 0, "Total tokens cannot be negative: %s", totalTokens);
        this.sessionId = sessionId;
        this.studentId = studentId;
        this.subject = subject;
        this.createdAt = createdAt;
        this.lastActivity = Objects.requireNonNullElse(lastActivity, createdAt);
        this.totalTokens = totalTokens;
        this.compressedContext = compressedContext;
        this.messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /**
     * A brand new session with no messages, no digest and zero tokens
     */
    public static Session create(final String sessionId,
                                 final String studentId,
                                 final String subject,
                                 final Instant now) {
        return Session.builder()
                .sessionId(sessionId)
                .studentId(studentId)
                .subject(subject)
                .createdAt(now)
                .lastActivity(now)
                .totalTokens(0)
                .messages(List.of())
                .build();
    }

    /**
     * Appends a message, adds its tokens to the running total and moves last activity forward
     *
     * @param message Message to append
     * @param now     Time of the append. Last activity never moves backwards.
     * @return Updated copy of the session
     */
    public Session append(@NonNull final Message message, @NonNull final Instant now) {
        final var updated = new ArrayList<>(messages);
        updated.add(message);
        return toBuilder()
                .messages(updated)
                .totalTokens(totalTokens + message.getTokenCount())
                .lastActivity(now.isAfter(lastActivity) ? now : lastActivity)
                .build();
    }

    /**
     * Replaces every message except the most recent {@code keepRecent} with the given digest.
     * The token total is recomputed from the retained messages.
     */
    public Session compact(@NonNull final String digest, final int keepRecent) {
        final var retained = recentMessages(keepRecent);
        return toBuilder()
                .messages(retained)
                .compressedContext(digest)
                .totalTokens(sumTokens(retained))
                .build();
    }

    /**
     * The retained tail: at most {@code count} of the latest messages, in chronological order
     */
    public List<Message> recentMessages(final int count) {
        Preconditions.checkArgument(count >= 0, "Count cannot be negative: %s", count);
        return messages.subList(Math.max(0, messages.size() - count), messages.size());
    }

    /**
     * Messages older than the retained tail of size {@code keepRecent}. Empty when there is nothing to compress.
     */
    public List<Message> messagesBeforeRecent(final int keepRecent) {
        Preconditions.checkArgument(keepRecent >= 0, "Count cannot be negative: %s", keepRecent);
        return messages.subList(0, Math.max(0, messages.size() - keepRecent));
    }

    public boolean compressed() {
        return compressedContext != null;
    }

    public static int sumTokens(final List<Message> messages) {
        return messages.stream()
                .mapToInt(Message::getTokenCount)
                .sum();
    }
}
