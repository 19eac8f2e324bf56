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

import com.phonepe.tutorai.core.model.Session;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local session storage used when no durable store is configured or reachable.
 * <p>
 * Entries never expire on their own, {@link #sweepExpired()} has to be called periodically
 * (see {@link com.phonepe.tutorai.core.session.SessionSweeper}).
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private record Entry(Session session, Duration ttl) {
    }

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStore() {
        this(null, null);
    }

    @Builder
    public InMemorySessionStore(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNullElse(ttl, SessionStoreConfig.DEFAULT_TTL);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    @Override
    public Optional<Session> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId))
                .map(Entry::session);
    }

    @Override
    public void put(@NonNull Session session, @NonNull Duration ttl) {
        sessions.put(session.getSessionId(), new Entry(session, ttl));
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public int sweepExpired() {
        final var now = clock.instant();
        var removed = 0;
        for (final var entry : sessions.entrySet()) {
            final var value = entry.getValue();
            final var expiresAt = value.session().getLastActivity().plus(value.ttl());
            // Conditional remove so that a concurrent put of a fresher copy survives
            if (expiresAt.isBefore(now) && sessions.remove(entry.getKey(), value)) {
                removed++;
            }
        }
        log.debug("Removed {} expired sessions. {} remaining", removed, sessions.size());
        return removed;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public SessionBackendType type() {
        return SessionBackendType.IN_MEMORY;
    }

    public int size() {
        return sessions.size();
    }
}
