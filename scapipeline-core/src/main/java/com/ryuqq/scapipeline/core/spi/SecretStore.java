package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.SecretPath;

import java.util.Optional;

/**
 * External store holding secret values.
 *
 * <p>Calls may perform network I/O. The core treats the store as read-only apart from
 * {@link #writeSecret} used when secrets are created.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SecretStore {

    /**
     * Reads a secret value.
     *
     * @param path the secret location
     * @return the value, or empty if the store has no value at this path
     */
    Optional<String> readSecret(SecretPath path);

    /**
     * Writes or replaces a secret value.
     *
     * @param path the secret location
     * @param value the value
     */
    void writeSecret(SecretPath path, String value);
}
