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

package com.phonepe.tutorai.storage.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.phonepe.tutorai.core.errors.ErrorType;
import com.phonepe.tutorai.core.errors.PersistenceUnavailableException;
import com.phonepe.tutorai.core.errors.TutorSessionException;
import com.phonepe.tutorai.core.model.Session;
import com.phonepe.tutorai.core.store.SessionBackendType;
import com.phonepe.tutorai.core.store.SessionStore;
import com.phonepe.tutorai.core.store.SessionStoreConfig;
import com.phonepe.tutorai.core.utils.JsonUtils;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable session storage. Each session is one JSON string under {@code session:<id>}, written with SETEX so that
 * every write restarts the expiry clock.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {
    public static final String KEY_PREFIX = "session:";

    private final RedisClient client;
    private final ObjectMapper mapper;
    private final Duration ttl;

    @Builder
    public RedisSessionStore(@NonNull RedisClient client, ObjectMapper mapper, Duration ttl) {
        this.client = client;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.ttl = Objects.requireNonNullElse(ttl, SessionStoreConfig.DEFAULT_TTL);
    }

    @Override
    public Optional<Session> get(String sessionId) {
        final String value;
        try {
            value = client.getJedis().get(key(sessionId));
        }
        catch (JedisException e) {
            throw new PersistenceUnavailableException(e);
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(value, Session.class));
        }
        catch (JsonProcessingException e) {
            log.error(ErrorType.DESERIALIZATION_ERROR.format(sessionId, e.getMessage()));
            return Optional.empty();
        }
    }

    @Override
    public void put(@NonNull Session session, @NonNull Duration ttl) {
        final String value;
        try {
            value = mapper.writeValueAsString(session);
        }
        catch (JsonProcessingException e) {
            throw new TutorSessionException(ErrorType.SERIALIZATION_ERROR,
                                            ErrorType.SERIALIZATION_ERROR.format(session.getSessionId(),
                                                                                 e.getMessage()),
                                            e);
        }
        try {
            client.getJedis().setex(key(session.getSessionId()), Math.max(1L, ttl.toSeconds()), value);
        }
        catch (JedisException e) {
            throw new PersistenceUnavailableException(e);
        }
        log.debug("Stored session {} with ttl {}", session.getSessionId(), ttl);
    }

    @Override
    public boolean delete(String sessionId) {
        try {
            return client.getJedis().del(key(sessionId)) > 0;
        }
        catch (JedisException e) {
            throw new PersistenceUnavailableException(e);
        }
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public SessionBackendType type() {
        return SessionBackendType.REDIS;
    }

    /**
     * @return true if the server answered PING
     */
    public boolean ping() {
        try {
            client.getJedis().sendCommand(Protocol.Command.PING);
            return true;
        }
        catch (JedisException e) {
            log.warn("Redis did not answer PING: {}", e.getMessage());
            return false;
        }
    }

    static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
