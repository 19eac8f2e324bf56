package com.phonepe.tutorai.core.errors;

import lombok.Getter;

/**
 * Raised when an operation references a session id that was never created or has expired
 */
@Getter
public class SessionNotFoundException extends TutorSessionException {
    private final String sessionId;

    public SessionNotFoundException(final String sessionId) {
        super(ErrorType.SESSION_NOT_FOUND, ErrorType.SESSION_NOT_FOUND.format(sessionId));
        this.sessionId = sessionId;
    }
}
