package com.phonepe.tutorai.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Lightweight view of a session for status endpoints
 */
@Value
@Builder
public class SessionInfo {
    String sessionId;
    String studentId;
    String subject;
    int messageCount;
    int totalTokens;
    boolean compressed;
    Instant createdAt;
    Instant lastActivity;

    public static SessionInfo of(final Session session) {
        return SessionInfo.builder()
                .sessionId(session.getSessionId())
                .studentId(session.getStudentId())
                .subject(session.getSubject())
                .messageCount(session.getMessages().size())
                .totalTokens(session.getTotalTokens())
                .compressed(session.compressed())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .build();
    }
}
