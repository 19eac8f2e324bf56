package com.phonepe.tutorai.core.tokens;

import com.google.common.base.Preconditions;

import lombok.Value;

/**
 * Result of a token count
 */
@Value
public class TokenCount {
    public enum Method {
        /**
         * Computed with the tokenizer of the target model
         */
        EXACT,
        /**
         * Estimated from the word count
         */
        APPROXIMATE
    }

    int value;
    Method method;

    private TokenCount(int value, Method method) {
        Preconditions.checkArgument(value >= 0, "Token count cannot be negative: %s", value);
        this.value = value;
        this.method = method;
    }

    public static TokenCount exact(int value) {
        return new TokenCount(value, Method.EXACT);
    }

    public static TokenCount approximate(int value) {
        return new TokenCount(value, Method.APPROXIMATE);
    }

    public boolean isExact() {
        return method == Method.EXACT;
    }
}
