package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.SecretPath;

/**
 * Thrown when the secret store holds no value for a referenced secret.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SecretNotFoundException extends RuntimeException {

    public SecretNotFoundException(SecretPath path) {
        super("No value found for secret '" + path.path() + "'.");
    }
}
