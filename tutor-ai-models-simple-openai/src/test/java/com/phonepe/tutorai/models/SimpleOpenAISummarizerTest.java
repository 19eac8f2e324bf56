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

package com.phonepe.tutorai.models;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;

import com.phonepe.tutorai.core.compression.CompressionEngine;
import com.phonepe.tutorai.core.compression.Digest;
import com.phonepe.tutorai.core.compression.SummarizationRequest;
import com.phonepe.tutorai.core.model.Message;
import com.phonepe.tutorai.core.model.Role;

import io.github.sashirestela.openai.SimpleOpenAIAzure;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okForContentType;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SimpleOpenAISummarizer}
 */
@WireMockTest
class SimpleOpenAISummarizerTest {
    private static final String COMPLETIONS_URL = "/chat/completions?api-version=2024-10-21";
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @Test
    void testSummarize(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(okForContentType("application/json", readStubFile(1, "summary"))));

        final var summary = summarizer(wiremock)
                .summarize(SummarizationRequest.builder()
                                   .model("gpt-4o-mini")
                                   .systemPrompt("You summarize tutoring conversations")
                                   .userPrompt("User: What is a derivative?")
                                   .build())
                .join();

        assertTrue(summary.startsWith("The student is learning derivatives."));
        verify(postRequestedFor(urlEqualTo(COMPLETIONS_URL))
                       .withRequestBody(matchingJsonPath("$.messages[0].content",
                                                         equalTo("You summarize tutoring conversations")))
                       .withRequestBody(matchingJsonPath("$.messages[1].content",
                                                         equalTo("User: What is a derivative?"))));
    }

    @Test
    void testCompressionWithOpenAISummarizer(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(okForContentType("application/json", readStubFile(1, "summary"))));

        final var digest = engine(wiremock, Duration.ofSeconds(10))
                .compress("s1", "mathematics", null, conversation());

        assertFalse(digest.isPlaceholder());
        assertTrue(digest.getText().contains("power rule"));
        verify(postRequestedFor(urlEqualTo(COMPLETIONS_URL))
                       .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini"))));
    }

    @Test
    void testServerErrorGivesPlaceholder(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(aResponse()
                                            .withStatus(500)
                                            .withBody("{\"error\":{\"message\":\"Internal error\"}}")));

        final var digest = engine(wiremock, Duration.ofSeconds(10))
                .compress("s1", "mathematics", null, conversation());

        assertTrue(digest.isPlaceholder());
        assertEquals(Digest.PLACEHOLDER_TEXT, digest.getText());
    }

    @Test
    void testSlowResponseGivesPlaceholder(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(okForContentType("application/json", readStubFile(1, "summary"))
                                            .withFixedDelay(2_000)));

        final var digest = engine(wiremock, Duration.ofMillis(200))
                .compress("s1", "mathematics", null, conversation());

        assertTrue(digest.isPlaceholder());
    }

    private static SimpleOpenAISummarizer summarizer(final WireMockRuntimeInfo wiremock) {
        return new SimpleOpenAISummarizer(SimpleOpenAIAzure.builder()
                                                  .baseUrl(wiremock.getHttpBaseUrl())
                                                  .apiKey("BLAH")
                                                  .apiVersion("2024-10-21")
                                                  .build());
    }

    private static CompressionEngine engine(final WireMockRuntimeInfo wiremock, final Duration timeout) {
        return CompressionEngine.builder()
                .summarizer(summarizer(wiremock))
                .model("gpt-4o-mini")
                .timeout(timeout)
                .build();
    }

    private static List<Message> conversation() {
        return List.of(message(Role.USER, "What is a derivative?"),
                       message(Role.ASSISTANT, "It measures how a function changes as its input changes."),
                       message(Role.USER, "How do I differentiate x^3?"),
                       message(Role.ASSISTANT, "Use the power rule: 3x^2."));
    }

    private static Message message(final Role role, final String content) {
        return Message.builder()
                .role(role)
                .content(content)
                .timestamp(NOW)
                .tokenCount(content.split(" ").length)
                .build();
    }

    @SneakyThrows
    private static String readStubFile(final int i, final String prefix) {
        return Files.readString(Path.of(Objects.requireNonNull(SimpleOpenAISummarizerTest.class.getResource(
                "/wiremock/%s.%d.json".formatted(prefix, i))).toURI()));
    }
}
