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

package com.phonepe.tutorai.core.compression;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Prompts used to summarize older turns of a tutoring session.
 * <p>
 * Available variables: {@code ${subject}}, {@code ${maxWords}}, {@code ${previousSummary}} (empty when there is no
 * earlier digest) and {@code ${conversation}}.
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class CompressionPrompts {
    public static final int DEFAULT_MAX_WORDS = 200;

    public static final String DEFAULT_SYSTEM_PROMPT = """
            You summarize tutoring conversations so that a tutor can continue helping the same student without the \
            original messages. Be factual and concise. Return only the summary with no headers or commentary.""";

    public static final String DEFAULT_USER_PROMPT = """
            Please create a concise summary of this educational conversation between a student and AI tutor in \
            ${subject}.

            Focus on:
            1. Key concepts discussed
            2. Problems solved
            3. Student's understanding progress
            4. Important context for future questions

            Keep the summary under ${maxWords} words but preserve all important educational context.
            ${previousSummary}
            Conversation to summarize:
            ${conversation}

            Summary:""";

    public static final String DEFAULT_PREVIOUS_SUMMARY_TEMPLATE = """

            The conversation continues from this earlier summary. Fold it into the new summary:
            ${digest}
            """;

    public static final CompressionPrompts DEFAULT = new CompressionPrompts(DEFAULT_SYSTEM_PROMPT,
                                                                            DEFAULT_USER_PROMPT,
                                                                            DEFAULT_PREVIOUS_SUMMARY_TEMPLATE,
                                                                            DEFAULT_MAX_WORDS);

    @Builder.Default
    String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    @Builder.Default
    String userPrompt = DEFAULT_USER_PROMPT;

    /**
     * Rendered into {@code ${previousSummary}} when the session already has a digest. Variable: {@code ${digest}}
     */
    @Builder.Default
    String previousSummaryTemplate = DEFAULT_PREVIOUS_SUMMARY_TEMPLATE;

    @Builder.Default
    int maxWords = DEFAULT_MAX_WORDS;
}
