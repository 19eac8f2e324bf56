package com.phonepe.tutorai.core.store;

import com.phonepe.tutorai.core.errors.PersistenceUnavailableException;
import com.phonepe.tutorai.core.model.Session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FailoverSessionStoreTest {
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
    private static final Duration TTL = Duration.ofHours(24);

    private SessionStore primary;
    private InMemorySessionStore secondary;
    private FailoverSessionStore store;

    @BeforeEach
    void setUp() {
        primary = mock(SessionStore.class);
        when(primary.ttl()).thenReturn(TTL);
        when(primary.type()).thenReturn(SessionBackendType.REDIS);
        secondary = new InMemorySessionStore();
        store = new FailoverSessionStore(primary, secondary);
    }

    @Test
    void testWritesGoToPrimary() {
        final var session = Session.create("s1", "student-1", "history", NOW);
        when(primary.get("s1")).thenReturn(Optional.of(session));

        store.put(session);

        verify(primary).put(session, TTL);
        assertEquals(0, secondary.size());
        assertEquals(session, store.get("s1").orElseThrow());
        assertEquals(SessionBackendType.REDIS, store.type());
    }

    @Test
    void testFailedWriteIsKeptInMemory() {
        final var session = Session.create("s1", "student-1", "history", NOW);
        doThrow(new PersistenceUnavailableException(new IllegalStateException("Connection refused")))
                .when(primary).put(any(), any());
        when(primary.get(anyString()))
                .thenThrow(new PersistenceUnavailableException(new IllegalStateException("Connection refused")));

        store.put(session);

        assertEquals(1, secondary.size());
        assertEquals(session, store.get("s1").orElseThrow());
        verify(primary, never()).get("s1");
    }

    @Test
    void testRecoveredPrimaryTakesOverDegradedCopy() {
        final var session = Session.create("s1", "student-1", "history", NOW);
        secondary.put(session);

        store.put(session);

        assertEquals(0, secondary.size());
        verify(primary).put(session, TTL);
    }

    @Test
    void testReadFailureIsTreatedAsMissing() {
        when(primary.get(anyString()))
                .thenThrow(new PersistenceUnavailableException(new IllegalStateException("Connection refused")));
        assertTrue(store.get("s1").isEmpty());
    }

    @Test
    void testDeleteFromBoth() {
        secondary.put(Session.create("s1", "student-1", "history", NOW));
        when(primary.delete("s1")).thenReturn(false);
        when(primary.delete("s2"))
                .thenThrow(new PersistenceUnavailableException(new IllegalStateException("Connection refused")));

        assertTrue(store.delete("s1"));
        assertFalse(store.delete("s2"));
        assertEquals(0, secondary.size());
    }

    @Test
    void testFailedDeleteIsRetried() {
        final var flaky = new FlakyStore();
        final var failover = new FailoverSessionStore(flaky, new InMemorySessionStore());
        failover.put(Session.create("s1", "student-1", "history", NOW));

        flaky.down = true;
        failover.delete("s1");
        assertTrue(failover.get("s1").isEmpty());

        flaky.down = false;
        assertTrue(flaky.get("s1").isPresent());
        assertTrue(failover.get("s1").isEmpty());
        assertTrue(flaky.get("s1").isEmpty());
    }

    @Test
    void testRewriteAfterFailedDelete() {
        final var flaky = new FlakyStore();
        final var failover = new FailoverSessionStore(flaky, new InMemorySessionStore());
        final var session = Session.create("s1", "student-1", "history", NOW);
        failover.put(session);

        flaky.down = true;
        failover.delete("s1");
        failover.put(session);
        assertEquals(session, failover.get("s1").orElseThrow());

        flaky.down = false;
        assertEquals(session, failover.get("s1").orElseThrow());
    }

    private static final class FlakyStore extends InMemorySessionStore {
        private volatile boolean down;

        @Override
        public Optional<Session> get(String sessionId) {
            failIfDown();
            return super.get(sessionId);
        }

        @Override
        public void put(Session session, Duration ttl) {
            failIfDown();
            super.put(session, ttl);
        }

        @Override
        public boolean delete(String sessionId) {
            failIfDown();
            return super.delete(sessionId);
        }

        @Override
        public SessionBackendType type() {
            return SessionBackendType.REDIS;
        }

        private void failIfDown() {
            if (down) {
                throw new PersistenceUnavailableException(new IllegalStateException("Connection refused"));
            }
        }
    }
}
