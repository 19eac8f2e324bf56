package com.phonepe.tutorai.core.errors;

/**
 * The durable session store could not be reached
 */
public class PersistenceUnavailableException extends TutorSessionException {
    public PersistenceUnavailableException(final Throwable cause) {
        super(ErrorType.PERSISTENCE_UNAVAILABLE,
              ErrorType.PERSISTENCE_UNAVAILABLE.format(cause.getMessage()),
              cause);
    }
}
