package com.phonepe.tutorai.core.store;

/**
 * The kind of backend chosen for session storage at start-up
 */
public enum SessionBackendType {
    /**
     * Networked store with server enforced expiry
     */
    REDIS,
    /**
     * Process local map, needs explicit sweeping
     */
    IN_MEMORY,
}
