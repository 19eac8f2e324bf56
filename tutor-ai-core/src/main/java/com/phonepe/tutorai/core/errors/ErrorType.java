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

package com.phonepe.tutorai.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure modes of the session subsystem. Only {@link #SESSION_NOT_FOUND} is ever surfaced to callers,
 * every other type is recovered from locally.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SESSION_NOT_FOUND("Session not found: %s", false),
    PERSISTENCE_UNAVAILABLE("Session store unavailable. Error: %s", true),
    COMPRESSION_FAILED("Context compression failed for session %s. Error: %s", true),
    TOKEN_COUNT_UNAVAILABLE("Exact token count unavailable for model %s. Error: %s", false),
    SERIALIZATION_ERROR("Error serializing session %s. Error: %s", false),
    DESERIALIZATION_ERROR("Error deserializing session %s. Error: %s", false),
    ;

    private final String message;
    private final boolean retryable;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
