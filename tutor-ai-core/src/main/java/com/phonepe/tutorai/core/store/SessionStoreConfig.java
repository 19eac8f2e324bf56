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

package com.phonepe.tutorai.core.store;

import com.google.common.base.Preconditions;

import com.phonepe.tutorai.core.utils.EnvLoader;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Settings used to pick and configure the session store at start-up
 */
@Value
@Builder
@With
public class SessionStoreConfig {
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    public static final String REDIS_URL_ENV = "TUTOR_REDIS_URL";
    public static final String REDIS_PASSWORD_ENV = "TUTOR_REDIS_PASSWORD";
    public static final String SESSION_TTL_HOURS_ENV = "TUTOR_SESSION_TTL_HOURS";

    public static final SessionStoreConfig DEFAULT = SessionStoreConfig.builder().build();

    /**
     * Idle time after which a session is removed. Refreshed on every write.
     */
    @Builder.Default
    Duration ttl = DEFAULT_TTL;

    /**
     * Redis url, ex: redis://localhost:6379/0. Sessions are kept in memory when this is not set.
     */
    String redisUrl;

    String redisPassword;

    @Builder.Default
    Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    public boolean durableStoreConfigured() {
        return redisUrl != null && !redisUrl.isBlank();
    }

    public static SessionStoreConfig fromEnvironment() {
        return fromSource(System::getenv);
    }

    static SessionStoreConfig fromSource(UnaryOperator<String> source) {
        final var ttlHours = EnvLoader.readOptional(SESSION_TTL_HOURS_ENV, source)
                .map(Long::parseLong)
                .orElse(DEFAULT_TTL.toHours());
        Preconditions.checkArgument(ttlHours > 0, "%s must be positive", SESSION_TTL_HOURS_ENV);
        return SessionStoreConfig.builder()
                .ttl(Duration.ofHours(ttlHours))
                .redisUrl(EnvLoader.readOptional(REDIS_URL_ENV, source).orElse(null))
                .redisPassword(EnvLoader.readOptional(REDIS_PASSWORD_ENV, source).orElse(null))
                .build();
    }
}
