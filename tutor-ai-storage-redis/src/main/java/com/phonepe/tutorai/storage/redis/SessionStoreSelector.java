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

import com.phonepe.tutorai.core.store.FailoverSessionStore;
import com.phonepe.tutorai.core.store.InMemorySessionStore;
import com.phonepe.tutorai.core.store.SessionStore;
import com.phonepe.tutorai.core.store.SessionStoreConfig;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.Function;

/**
 * Picks the session backend once at start-up. Redis is used when it is configured and answers PING, with an in-memory
 * store taking over individual operations when Redis errors later. Otherwise sessions live in memory only.
 */
@Slf4j
public class SessionStoreSelector implements AutoCloseable {
    private final SessionStoreConfig config;
    private final Function<SessionStoreConfig, RedisClient> redisClientFactory;

    private RedisClient redisClient;
    private SessionStore selected;

    @Builder
    public SessionStoreSelector(SessionStoreConfig config,
                                Function<SessionStoreConfig, RedisClient> redisClientFactory) {
        this.config = Objects.requireNonNullElse(config, SessionStoreConfig.DEFAULT);
        this.redisClientFactory = Objects.requireNonNullElse(redisClientFactory, SessionStoreSelector::connect);
    }

    /**
     * @return The selected store. Repeated calls return the same instance.
     */
    public synchronized SessionStore select() {
        if (selected == null) {
            selected = selectStore();
            log.info("Using {} session store", selected.type());
        }
        return selected;
    }

    @Override
    public synchronized void close() {
        if (redisClient != null) {
            redisClient.close();
            redisClient = null;
        }
    }

    private SessionStore selectStore() {
        final var inMemory = InMemorySessionStore.builder()
                .ttl(config.getTtl())
                .build();
        if (!config.durableStoreConfigured()) {
            log.info("No redis url configured");
            return inMemory;
        }
        try {
            redisClient = redisClientFactory.apply(config);
            final var redis = RedisSessionStore.builder()
                    .client(redisClient)
                    .ttl(config.getTtl())
                    .build();
            if (redis.ping()) {
                return new FailoverSessionStore(redis, inMemory);
            }
        }
        catch (RuntimeException e) {
            log.warn("Could not connect to redis: {}", e.getMessage());
        }
        log.warn("Redis is unreachable. Sessions will not survive a restart");
        close();
        return inMemory;
    }

    private static RedisClient connect(SessionStoreConfig config) {
        return RedisClient.builder()
                .url(config.getRedisUrl())
                .password(config.getRedisPassword())
                .connectTimeout(config.getConnectTimeout())
                .build();
    }
}
