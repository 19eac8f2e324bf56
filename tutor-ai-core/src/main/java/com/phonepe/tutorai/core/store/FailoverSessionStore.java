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

import com.phonepe.tutorai.core.errors.PersistenceUnavailableException;
import com.phonepe.tutorai.core.model.Session;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps sessions available while the durable store is down.
 * <p>
 * Writes that fail on the primary land in the secondary. A successful primary write evicts the secondary copy, so
 * anything present in the secondary is always at least as new as what the primary holds and is read first.
 * <p>
 * Deletes that fail on the primary are remembered and retried on later calls. Until the primary confirms the delete,
 * the session reads as missing here even though the primary may still hold it.
 */
@Slf4j
public class FailoverSessionStore implements SessionStore {
    private final SessionStore primary;
    private final SessionStore secondary;
    private final Set<String> pendingDeletes = ConcurrentHashMap.newKeySet();

    public FailoverSessionStore(@NonNull SessionStore primary, @NonNull SessionStore secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public Optional<Session> get(String sessionId) {
        retryPendingDeletes();
        final var degraded = secondary.get(sessionId);
        if (degraded.isPresent()) {
            return degraded;
        }
        if (pendingDeletes.contains(sessionId)) {
            return Optional.empty();
        }
        try {
            return primary.get(sessionId);
        }
        catch (PersistenceUnavailableException e) {
            log.warn("Could not read session {} from {} store: {}", sessionId, primary.type(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(@NonNull Session session, @NonNull Duration ttl) {
        retryPendingDeletes();
        pendingDeletes.remove(session.getSessionId());
        try {
            primary.put(session, ttl);
            secondary.delete(session.getSessionId());
        }
        catch (PersistenceUnavailableException e) {
            log.warn("Could not write session {} to {} store, keeping it in {} store: {}",
                     session.getSessionId(), primary.type(), secondary.type(), e.getMessage());
            secondary.put(session, ttl);
        }
    }

    @Override
    public boolean delete(String sessionId) {
        retryPendingDeletes();
        final var fromSecondary = secondary.delete(sessionId);
        try {
            return primary.delete(sessionId) || fromSecondary;
        }
        catch (PersistenceUnavailableException e) {
            log.warn("Could not delete session {} from {} store, will retry: {}",
                     sessionId, primary.type(), e.getMessage());
            pendingDeletes.add(sessionId);
            return fromSecondary;
        }
    }

    @Override
    public int sweepExpired() {
        retryPendingDeletes();
        return primary.sweepExpired() + secondary.sweepExpired();
    }

    @Override
    public Duration ttl() {
        return primary.ttl();
    }

    @Override
    public SessionBackendType type() {
        return primary.type();
    }

    private void retryPendingDeletes() {
        for (final var sessionId : pendingDeletes) {
            try {
                primary.delete(sessionId);
            }
            catch (PersistenceUnavailableException e) {
                log.debug("{} store still unavailable, {} deletes pending", primary.type(), pendingDeletes.size());
                return;
            }
            pendingDeletes.remove(sessionId);
            log.info("Deleted session {} from {} store on retry", sessionId, primary.type());
        }
    }
}
