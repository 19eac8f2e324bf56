package com.phonepe.tutorai.storage.redis;

import com.phonepe.tutorai.core.store.FailoverSessionStore;
import com.phonepe.tutorai.core.store.InMemorySessionStore;
import com.phonepe.tutorai.core.store.SessionBackendType;
import com.phonepe.tutorai.core.store.SessionStoreConfig;

import org.junit.jupiter.api.Test;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link SessionStoreSelector}
 */
class SessionStoreSelectorTest {

    @Test
    void testInMemoryWhenRedisNotConfigured() {
        final var calls = new AtomicInteger();
        try (final var selector = SessionStoreSelector.builder()
                .config(SessionStoreConfig.DEFAULT.withTtl(Duration.ofHours(2)))
                .redisClientFactory(config -> {
                    calls.incrementAndGet();
                    return new RedisClient(mock(UnifiedJedis.class));
                })
                .build()) {
            final var store = selector.select();
            assertInstanceOf(InMemorySessionStore.class, store);
            assertEquals(SessionBackendType.IN_MEMORY, store.type());
            assertEquals(Duration.ofHours(2), store.ttl());
            assertEquals(0, calls.get());
        }
    }

    @Test
    void testRedisWhenReachable() {
        final var jedis = mock(UnifiedJedis.class);
        when(jedis.sendCommand(Protocol.Command.PING)).thenReturn("PONG".getBytes());
        try (final var selector = SessionStoreSelector.builder()
                .config(SessionStoreConfig.DEFAULT.withRedisUrl("redis://localhost:6379"))
                .redisClientFactory(config -> new RedisClient(jedis))
                .build()) {
            final var store = selector.select();
            assertInstanceOf(FailoverSessionStore.class, store);
            assertEquals(SessionBackendType.REDIS, store.type());
            assertSame(store, selector.select());
        }
        verify(jedis).close();
    }

    @Test
    void testFallsBackToMemoryWhenRedisUnreachable() {
        final var jedis = mock(UnifiedJedis.class);
        when(jedis.sendCommand(Protocol.Command.PING)).thenThrow(new JedisConnectionException("Connection refused"));
        try (final var selector = SessionStoreSelector.builder()
                .config(SessionStoreConfig.DEFAULT.withRedisUrl("redis://localhost:6379"))
                .redisClientFactory(config -> new RedisClient(jedis))
                .build()) {
            assertEquals(SessionBackendType.IN_MEMORY, selector.select().type());
            verify(jedis).close();
        }
    }

    @Test
    void testFallsBackToMemoryWhenClientCannotBeCreated() {
        try (final var selector = SessionStoreSelector.builder()
                .config(SessionStoreConfig.DEFAULT.withRedisUrl("redis://localhost:6379"))
                .redisClientFactory(config -> {
                    throw new IllegalStateException("No route to host");
                })
                .build()) {
            assertEquals(SessionBackendType.IN_MEMORY, selector.select().type());
        }
    }
}
