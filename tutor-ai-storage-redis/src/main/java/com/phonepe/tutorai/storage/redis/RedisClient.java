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

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.util.JedisURIHelper;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Redis connection pool wrapper
 */
public class RedisClient implements AutoCloseable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    @Getter
    private final UnifiedJedis jedis;

    /**
     * @param url            Redis url, ex: redis://localhost:6379/0. Use rediss:// for TLS.
     * @param password       Overrides the password in the url if set
     * @param connectTimeout Connection and socket timeout
     */
    @Builder
    public RedisClient(@NonNull String url, String password, Duration connectTimeout) {
        final var uri = URI.create(url);
        final var timeoutMillis = (int) Objects.requireNonNullElse(connectTimeout, DEFAULT_TIMEOUT).toMillis();
        final var clientConfig = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeoutMillis)
                .socketTimeoutMillis(timeoutMillis)
                .user(JedisURIHelper.getUser(uri))
                .password(Objects.requireNonNullElse(password, JedisURIHelper.getPassword(uri)))
                .database(JedisURIHelper.getDBIndex(uri))
                .ssl(JedisURIHelper.isRedisSSLScheme(uri))
                .build();
        this.jedis = new JedisPooled(JedisURIHelper.getHostAndPort(uri), clientConfig);
    }

    public RedisClient(@NonNull UnifiedJedis jedis) {
        this.jedis = jedis;
    }

    @Override
    public void close() {
        jedis.close();
    }
}
