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

import com.phonepe.tutorai.core.compression.SummarizationRequest;
import com.phonepe.tutorai.core.compression.Summarizer;
import com.phonepe.tutorai.core.utils.EnvLoader;

import io.github.sashirestela.openai.SimpleOpenAI;
import io.github.sashirestela.openai.domain.chat.Chat;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Summarizer} backed by an OpenAI compatible chat completions endpoint
 */
@Slf4j
public class SimpleOpenAISummarizer implements Summarizer {
    public static final String API_KEY_ENV = "OPENAI_API_KEY";
    public static final String BASE_URL_ENV = "OPENAI_BASE_URL";

    private final ChatCompletionServiceFactory providerFactory;

    public SimpleOpenAISummarizer(@NonNull final ChatCompletionServices provider) {
        this(modelName -> provider);
    }

    public SimpleOpenAISummarizer(@NonNull final ChatCompletionServiceFactory providerFactory) {
        this.providerFactory = providerFactory;
    }

    /**
     * Summarizer talking to OpenAI using {@value #API_KEY_ENV}. {@value #BASE_URL_ENV} can point it to a compatible
     * endpoint.
     */
    public static SimpleOpenAISummarizer fromEnvironment() {
        final var builder = SimpleOpenAI.builder()
                .apiKey(EnvLoader.readEnv(API_KEY_ENV));
        EnvLoader.readOptional(BASE_URL_ENV, System::getenv)
                .ifPresent(builder::baseUrl);
        return new SimpleOpenAISummarizer(builder.build());
    }

    @Override
    public CompletableFuture<String> summarize(final SummarizationRequest request) {
        final var chatRequest = ChatRequest.builder()
                .model(request.getModel())
                .messages(List.of(ChatMessage.SystemMessage.of(request.getSystemPrompt()),
                                  ChatMessage.UserMessage.of(request.getUserPrompt())))
                .temperature(request.getTemperature())
                .maxCompletionTokens(request.getMaxOutputTokens())
                .n(1)
                .build();
        return providerFactory.get(request.getModel())
                .chatCompletions()
                .create(chatRequest)
                .thenApply(SimpleOpenAISummarizer::extractSummary);
    }

    private static String extractSummary(final Chat chat) {
        log.debug("Summarization usage: {}", chat.getUsage());
        return Objects.requireNonNullElse(chat.getChoices(), List.<Chat.Choice>of())
                .stream()
                .findFirst()
                .map(choice -> choice.getMessage().getContent())
                .orElseThrow(() -> new IllegalStateException("No summary in chat completion response"));
    }
}
