package com.phonepe.tutorai.core.tokens;

/**
 * Estimates the token cost of text for a target model.
 * <p>
 * Implementations must never fail the caller: when an exact tokenizer is unavailable they fall back to a
 * deterministic approximation and say so through {@link TokenCount#getMethod()}.
 */
@FunctionalInterface
public interface TokenCounter {
    /**
     * Count tokens in the given text
     *
     * @param text  Text to count tokens in. Null or blank text costs nothing.
     * @param model Name of the model the text will be sent to (ex: "gpt-4o-mini")
     * @return Non-negative token count along with how it was computed
     */
    TokenCount count(final String text, final String model);
}
