package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.Secret;

/**
 * An environment variable set for the stage process.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface EnvironmentVariableDefinition {

    String name();

    /**
     * Variable whose value is read from a secret.
     *
     * @param name variable name
     * @param secret secret holding the value
     */
    record SecretVariable(String name, Secret secret) implements EnvironmentVariableDefinition {

        public SecretVariable {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (secret == null) {
                throw new IllegalArgumentException("secret cannot be null");
            }
        }
    }

    /**
     * Variable with a literal value.
     *
     * @param name variable name
     * @param value value
     */
    record LiteralVariable(String name, String value) implements EnvironmentVariableDefinition {

        public LiteralVariable {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String toString() {
            return "LiteralVariable[name=" + name + "]";
        }
    }
}
