package com.phonepe.tutorai.models;

import io.github.sashirestela.openai.service.ChatCompletionServices;

/**
 * Resolves the chat completion provider to use for a model
 */
@FunctionalInterface
public interface ChatCompletionServiceFactory {
    ChatCompletionServices get(final String modelName);
}
