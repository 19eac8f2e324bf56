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

package com.phonepe.tutorai.core.session;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Token budget and compression policy for {@link SessionManager}
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class SessionManagerSetup {
    public static final int DEFAULT_MAX_CONTEXT_TOKENS = 4000;
    public static final int DEFAULT_COMPRESSION_THRESHOLD = 3000;
    public static final int DEFAULT_KEEP_RECENT_MESSAGES = 6;
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public static final SessionManagerSetup DEFAULT = new SessionManagerSetup(
            DEFAULT_MAX_CONTEXT_TOKENS,
            DEFAULT_COMPRESSION_THRESHOLD,
            DEFAULT_KEEP_RECENT_MESSAGES,
            DEFAULT_MODEL,
            SummaryInclusion.OVER_THRESHOLD);

    /**
     * Hard ceiling on tokens sent to the model
     */
    @Builder.Default
    int maxContextTokens = DEFAULT_MAX_CONTEXT_TOKENS;

    /**
     * Older messages are compacted into a digest once the session total goes above this. Must be lower than
     * {@link #maxContextTokens}.
     */
    @Builder.Default
    int compressionThreshold = DEFAULT_COMPRESSION_THRESHOLD;

    /**
     * Size of the tail of latest messages that are never compacted
     */
    @Builder.Default
    int keepRecentMessages = DEFAULT_KEEP_RECENT_MESSAGES;

    /**
     * Model whose tokenizer is used to count message tokens
     */
    @Builder.Default
    String model = DEFAULT_MODEL;

    @Builder.Default
    SummaryInclusion summaryInclusion = SummaryInclusion.OVER_THRESHOLD;
}
