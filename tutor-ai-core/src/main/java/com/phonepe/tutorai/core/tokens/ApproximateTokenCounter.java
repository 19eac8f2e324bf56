package com.phonepe.tutorai.core.tokens;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * Word count based estimate, roughly 1.3 tokens per whitespace separated word for English prose.
 * Ignores the model.
 */
public class ApproximateTokenCounter implements TokenCounter {
    public static final double DEFAULT_TOKENS_PER_WORD = 1.3;

    private static final Splitter WORD_SPLITTER = Splitter.on(CharMatcher.whitespace())
            .omitEmptyStrings();

    private final double tokensPerWord;

    public ApproximateTokenCounter() {
        this(DEFAULT_TOKENS_PER_WORD);
    }

    public ApproximateTokenCounter(double tokensPerWord) {
        Preconditions.checkArgument(tokensPerWord >= 0, "Tokens per word cannot be negative: %s", tokensPerWord);
        this.tokensPerWord = tokensPerWord;
    }

    @Override
    public TokenCount count(String text, String model) {
        if (Strings.isNullOrEmpty(text)) {
            return TokenCount.approximate(0);
        }
        final var words = WORD_SPLITTER.splitToList(text).size();
        return TokenCount.approximate((int) (words * tokensPerWord));
    }
}
