package com.phonepe.tutorai.core.store;

import com.phonepe.tutorai.core.model.Session;

import java.time.Duration;
import java.util.Optional;

/**
 * Key addressed storage for sessions with expiry.
 * <p>
 * Writes are last-write-wins and always carry the full session. A {@link #get(String)} following a
 * {@link #put(Session)} on the same instance observes the write.
 */
public interface SessionStore {

    Optional<Session> get(String sessionId);

    /**
     * Stores the session, (re)starting its expiry clock
     *
     * @param session Session to store
     * @param ttl     Idle time after which the session may be removed
     */
    void put(Session session, Duration ttl);

    default void put(Session session) {
        put(session, ttl());
    }

    /**
     * Removes a session. Deleting an unknown id is not an error.
     *
     * @return true if something was removed
     */
    boolean delete(String sessionId);

    /**
     * Removes sessions that have been idle for longer than their TTL. Stores with server side expiry need not do
     * anything here.
     *
     * @return Number of sessions removed
     */
    default int sweepExpired() {
        return 0;
    }

    /**
     * Default TTL applied by {@link #put(Session)}
     */
    Duration ttl();

    SessionBackendType type();
}
