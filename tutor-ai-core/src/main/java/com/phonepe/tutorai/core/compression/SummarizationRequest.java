package com.phonepe.tutorai.core.compression;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single summarization call
 */
@Value
@Builder
public class SummarizationRequest {
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 300;

    @NonNull
    String model;

    @NonNull
    String systemPrompt;

    @NonNull
    String userPrompt;

    @Builder.Default
    double temperature = DEFAULT_TEMPERATURE;

    @Builder.Default
    int maxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;
}
