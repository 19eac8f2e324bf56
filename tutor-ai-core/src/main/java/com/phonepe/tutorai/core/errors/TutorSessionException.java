package com.phonepe.tutorai.core.errors;

import lombok.Getter;

/**
 * Base class for all errors raised by the session subsystem
 */
@Getter
public class TutorSessionException extends RuntimeException {
    private final ErrorType errorType;

    public TutorSessionException(final ErrorType errorType, final String message) {
        super(message);
        this.errorType = errorType;
    }

    public TutorSessionException(final ErrorType errorType, final String message, final Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
