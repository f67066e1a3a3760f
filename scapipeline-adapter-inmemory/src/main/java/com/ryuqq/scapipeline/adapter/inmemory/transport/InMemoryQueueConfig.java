package com.ryuqq.scapipeline.adapter.inmemory.transport;

/**
 * In-memory queue settings.
 *
 * @param visibilityTimeoutMs time a received message stays invisible before it is redelivered
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InMemoryQueueConfig(long visibilityTimeoutMs) {

    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    public InMemoryQueueConfig {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
    }

    /**
     * Default settings (30 second visibility timeout).
     */
    public InMemoryQueueConfig() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    public InMemoryQueueConfig withVisibilityTimeoutMs(long newVisibilityTimeoutMs) {
        return new InMemoryQueueConfig(newVisibilityTimeoutMs);
    }
}
