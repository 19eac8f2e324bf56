package com.phonepe.tutorai.core.session;

/**
 * When the digest of compacted messages is sent along with the context
 */
public enum SummaryInclusion {
    /**
     * Only when the session is over the compression threshold
     */
    OVER_THRESHOLD,
    /**
     * Whenever the session has a digest
     */
    ALWAYS,
}
