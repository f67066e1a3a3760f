package com.ryuqq.scapipeline.core.spi;

/**
 * Thrown by a {@link ConfigManager} when configuration content cannot be provided.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
