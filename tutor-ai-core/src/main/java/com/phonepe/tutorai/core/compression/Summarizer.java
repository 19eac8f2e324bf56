package com.phonepe.tutorai.core.compression;

import java.util.concurrent.CompletableFuture;

/**
 * Text summarization capability backed by a language model. Implementations may complete the future exceptionally;
 * {@link CompressionEngine} turns any failure into a placeholder digest.
 */
@FunctionalInterface
public interface Summarizer {
    CompletableFuture<String> summarize(final SummarizationRequest request);
}
