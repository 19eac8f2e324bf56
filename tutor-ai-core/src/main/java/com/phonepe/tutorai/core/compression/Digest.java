package com.phonepe.tutorai.core.compression;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Output of a compression attempt. A placeholder digest means summarization failed and the session should be left
 * as is.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Digest {
    public static final String PLACEHOLDER_TEXT = "Previous conversation context available.";

    String text;
    boolean placeholder;

    public static Digest of(final String text) {
        return new Digest(text, false);
    }

    public static Digest placeholder() {
        return new Digest(PLACEHOLDER_TEXT, true);
    }
}
