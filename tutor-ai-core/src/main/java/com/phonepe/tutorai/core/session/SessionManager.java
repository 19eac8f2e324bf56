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

package com.phonepe.tutorai.core.session;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.Striped;

import com.phonepe.tutorai.core.compression.CompressionEngine;
import com.phonepe.tutorai.core.errors.SessionNotFoundException;
import com.phonepe.tutorai.core.model.ContextMessage;
import com.phonepe.tutorai.core.model.Message;
import com.phonepe.tutorai.core.model.Role;
import com.phonepe.tutorai.core.model.Session;
import com.phonepe.tutorai.core.model.SessionInfo;
import com.phonepe.tutorai.core.store.SessionStore;
import com.phonepe.tutorai.core.tokens.JTokkitTokenCounter;
import com.phonepe.tutorai.core.tokens.TokenCounter;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Keeps tutoring conversations within a token budget.
 * <p>
 * Every turn is appended to the stored session. Once the running token total goes above the compression threshold,
 * all but the latest few messages are summarized into a digest that stands in for them in later context. Mutations of
 * a session are serialized through a per-session lock and always written back as a whole.
 */
@Slf4j
public class SessionManager {
    public static final String SUMMARY_PREFIX = "Previous conversation summary: ";
    private static final int LOCK_STRIPES = 256;

    private final SessionStore store;
    private final TokenCounter tokenCounter;
    private final CompressionEngine compressionEngine;
    @Getter
    private final SessionManagerSetup setup;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final Striped<Lock> locks = Striped.lazyWeakLock(LOCK_STRIPES);

    @Builder
    public SessionManager(@NonNull SessionStore store,
                          TokenCounter tokenCounter,
                          @NonNull CompressionEngine compressionEngine,
                          SessionManagerSetup setup,
                          Clock clock,
                          Supplier<String> idGenerator) {
        this.store = store;
        this.tokenCounter = Objects.requireNonNullElseGet(tokenCounter, JTokkitTokenCounter::new);
        this.compressionEngine = compressionEngine;
        this.setup = Objects.requireNonNullElse(setup, SessionManagerSetup.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.idGenerator = Objects.requireNonNullElse(idGenerator, () -> UUID.randomUUID().toString());
        Preconditions.checkArgument(this.setup.getCompressionThreshold() >= 0,
                                    "Compression threshold cannot be negative");
        Preconditions.checkArgument(this.setup.getCompressionThreshold() < this.setup.getMaxContextTokens(),
                                    "Compression threshold %s must be lower than max context tokens %s",
                                    this.setup.getCompressionThreshold(), this.setup.getMaxContextTokens());
        Preconditions.checkArgument(this.setup.getKeepRecentMessages() > 0,
                                    "At least one recent message must be kept");
        log.info("Session manager started with {} store. Threshold: {} tokens, ceiling: {} tokens, keeping {} recent "
                         + "messages", store.type(), this.setup.getCompressionThreshold(),
                 this.setup.getMaxContextTokens(), this.setup.getKeepRecentMessages());
    }

    public Session createSession(final String studentId, final String subject) {
        final var session = Session.create(idGenerator.get(), studentId, subject, clock.instant());
        store.put(session);
        log.info("Created session {} for student {} in {}", session.getSessionId(), studentId, subject);
        return session;
    }

    public Optional<Session> findSession(final String sessionId) {
        if (Strings.isNullOrEmpty(sessionId)) {
            return Optional.empty();
        }
        return store.get(sessionId);
    }

    /**
     * @throws SessionNotFoundException if no live session exists for the id
     */
    public Session getSession(final String sessionId) {
        return findSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Appends a message to the session and compresses older turns if the session went over the threshold. Compression
     * failures never fail this call.
     *
     * @return The session as stored after this call
     * @throws SessionNotFoundException if no live session exists for the id
     */
    public Session addMessage(final String sessionId, @NonNull final Role role, @NonNull final String content) {
        if (Strings.isNullOrEmpty(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        final var lock = locks.get(sessionId);
        lock.lock();
        try {
            final var session = getSession(sessionId);
            final var tokens = tokenCounter.count(content, setup.getModel());
            final var now = clock.instant();
            final var message = Message.builder()
                    .role(role)
                    .content(content)
                    .timestamp(now)
                    .tokenCount(tokens.getValue())
                    .build();
            final var updated = session.append(message, now);
            store.put(updated);
            log.debug("Added {} message with {} ({}) tokens to session {}. Total: {}",
                      role, tokens.getValue(), tokens.getMethod(), sessionId, updated.getTotalTokens());
            if (updated.getTotalTokens() > setup.getCompressionThreshold()) {
                log.info("Session {} is at {} tokens, above threshold of {}. Compressing",
                         sessionId, updated.getTotalTokens(), setup.getCompressionThreshold());
                return compressLocked(updated);
            }
            return updated;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Replaces all but the latest {@code keepRecentMessages} messages with a digest. Does nothing if there are no
     * older messages, so calling this twice in a row compresses at most once. If summarization fails the session is
     * returned unchanged.
     * <p>
     * Only the id of the given session is used. The stored copy is compressed, so messages appended after the caller
     * read the session are kept.
     *
     * @return The session as stored after this call
     * @throws SessionNotFoundException if the session no longer exists
     */
    public Session compress(@NonNull final Session session) {
        return compress(session.getSessionId());
    }

    /**
     * @see #compress(Session)
     */
    public Session compress(final String sessionId) {
        if (Strings.isNullOrEmpty(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        final var lock = locks.get(sessionId);
        lock.lock();
        try {
            return compressLocked(getSession(sessionId));
        }
        finally {
            lock.unlock();
        }
    }

    // Caller must hold the session lock and pass the latest stored copy
    private Session compressLocked(final Session session) {
        final var keepRecent = setup.getKeepRecentMessages();
        final var toCompress = session.messagesBeforeRecent(keepRecent);
        if (toCompress.isEmpty()) {
            log.debug("Nothing to compress for session {}", session.getSessionId());
            return session;
        }
        final var digest = compressionEngine.compress(session.getSessionId(),
                                                      session.getSubject(),
                                                      session.getCompressedContext(),
                                                      toCompress);
        if (digest.isPlaceholder()) {
            log.warn("Summarization failed for session {}. Keeping all {} messages",
                     session.getSessionId(), session.getMessages().size());
            return session;
        }
        final var compacted = session.compact(digest.getText(), keepRecent);
        store.put(compacted);
        log.info("Compressed {} messages of session {}. Tokens: {} -> {}",
                 toCompress.size(), session.getSessionId(), session.getTotalTokens(),
                 compacted.getTotalTokens());
        return compacted;
    }

    /**
     * Builds the ordered list of messages to send to the model. This does not modify the session.
     *
     * @param session      Session to build context for
     * @param systemPrompt Always the first entry
     * @return System prompt, optionally the digest of older turns, then the conversation
     */
    public List<ContextMessage> getContextForApi(@NonNull final Session session, @NonNull final String systemPrompt) {
        final var context = new ArrayList<ContextMessage>();
        context.add(ContextMessage.system(systemPrompt));
        final var overThreshold = session.getTotalTokens() > setup.getCompressionThreshold();
        if (session.compressed()
                && (overThreshold || setup.getSummaryInclusion() == SummaryInclusion.ALWAYS)) {
            context.add(ContextMessage.system(SUMMARY_PREFIX + session.getCompressedContext()));
        }
        final var messages = overThreshold
                             ? session.recentMessages(setup.getKeepRecentMessages())
                             : session.getMessages();
        messages.forEach(message -> context.add(ContextMessage.of(message)));
        final var messageTokens = Session.sumTokens(messages);
        if (messageTokens > setup.getMaxContextTokens()) {
            log.warn("Context for session {} carries {} message tokens, more than the ceiling of {}",
                     session.getSessionId(), messageTokens, setup.getMaxContextTokens());
        }
        return Collections.unmodifiableList(context);
    }

    /**
     * @throws SessionNotFoundException if no live session exists for the id
     */
    public List<ContextMessage> getContextForApi(final String sessionId, @NonNull final String systemPrompt) {
        return getContextForApi(getSession(sessionId), systemPrompt);
    }

    /**
     * Deletes the session. Deleting an unknown id is not an error.
     *
     * @return true if a session was removed
     */
    public boolean deleteSession(final String sessionId) {
        if (Strings.isNullOrEmpty(sessionId)) {
            return false;
        }
        final var lock = locks.get(sessionId);
        lock.lock();
        try {
            final var deleted = store.delete(sessionId);
            log.info("Delete session {}: {}", sessionId, deleted ? "removed" : "not found");
            return deleted;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @throws SessionNotFoundException if no live session exists for the id
     */
    public SessionInfo describe(final String sessionId) {
        return SessionInfo.of(getSession(sessionId));
    }

    /**
     * Removes idle sessions from stores that do not expire them on their own
     *
     * @return Number of sessions removed
     */
    public int sweepExpired() {
        final var removed = store.sweepExpired();
        if (removed > 0) {
            log.info("Swept {} expired sessions", removed);
        }
        return removed;
    }
}
