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

package com.phonepe.tutorai.core.compression;

import com.google.common.base.Strings;

import com.phonepe.tutorai.core.errors.ErrorType;
import com.phonepe.tutorai.core.model.Message;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Summarizes older turns of a session into a digest.
 * <p>
 * This never throws for summarizer failures. A failed, timed out or empty summarization produces
 * {@link Digest#placeholder()} so that callers can keep the session untouched.
 */
@Slf4j
public class CompressionEngine {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final Summarizer summarizer;
    private final CompressionPrompts prompts;
    private final String model;
    private final Duration timeout;

    @Builder
    public CompressionEngine(@NonNull Summarizer summarizer,
                             CompressionPrompts prompts,
                             String model,
                             Duration timeout) {
        this.summarizer = summarizer;
        this.prompts = Objects.requireNonNullElse(prompts, CompressionPrompts.DEFAULT);
        this.model = Objects.requireNonNullElse(model, DEFAULT_MODEL);
        this.timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    }

    /**
     * Summarizes the given messages
     *
     * @param sessionId       Used for logging only
     * @param subject         Subject of the tutoring session
     * @param previousSummary Existing digest of even older messages, null if none. It is folded into the new digest.
     * @param messages        Messages to summarize in chronological order
     * @return A real digest or a placeholder if summarization failed
     */
    public Digest compress(final String sessionId,
                           final String subject,
                           final String previousSummary,
                           @NonNull final List<Message> messages) {
        final var request = SummarizationRequest.builder()
                .model(model)
                .systemPrompt(prompts.getSystemPrompt())
                .userPrompt(userPrompt(subject, previousSummary, messages))
                .build();
        log.debug("Using summarization user prompt for session {}: {}", sessionId, request.getUserPrompt());
        CompletableFuture<String> future = null;
        try {
            future = summarizer.summarize(request);
            final var summary = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (summary == null || summary.isBlank()) {
                log.warn(ErrorType.COMPRESSION_FAILED.format(sessionId, "Empty summary received"));
                return Digest.placeholder();
            }
            log.info("Compressed {} messages of session {} into a summary of {} characters",
                     messages.size(), sessionId, summary.length());
            return Digest.of(summary.strip());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn(ErrorType.COMPRESSION_FAILED.format(sessionId, "Interrupted"));
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn(ErrorType.COMPRESSION_FAILED.format(sessionId, "Timed out after " + timeout));
        }
        catch (ExecutionException e) {
            final var cause = Objects.requireNonNullElse(e.getCause(), e);
            log.warn(ErrorType.COMPRESSION_FAILED.format(sessionId, cause.getMessage()), cause);
        }
        catch (RuntimeException e) {
            log.warn(ErrorType.COMPRESSION_FAILED.format(sessionId, e.getMessage()), e);
        }
        return Digest.placeholder();
    }

    String userPrompt(final String subject, final String previousSummary, final List<Message> messages) {
        final var previousSection = Strings.isNullOrEmpty(previousSummary)
                                    ? ""
                                    : StringSubstitutor.replace(prompts.getPreviousSummaryTemplate(),
                                                                Map.of("digest", previousSummary));
        return StringSubstitutor.replace(prompts.getUserPrompt(),
                                         Map.of("subject", Strings.nullToEmpty(subject),
                                                "maxWords", prompts.getMaxWords(),
                                                "previousSummary", previousSection,
                                                "conversation", transcript(messages)));
    }

    static String transcript(final List<Message> messages) {
        return messages.stream()
                .map(message -> message.getRole().label() + ": " + message.getContent())
                .collect(Collectors.joining("\n"));
    }
}
