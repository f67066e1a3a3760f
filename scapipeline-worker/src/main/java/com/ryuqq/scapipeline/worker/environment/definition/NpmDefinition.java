package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;

import java.util.Set;

/**
 * A registry entry in {@code .npmrc}.
 *
 * @param service referenced service
 * @param credentialsTypes credentials exposure
 * @param scope package scope bound to the registry (null for the default registry)
 * @param email email written for the registry (nullable)
 * @param authMode credentials format
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NpmDefinition(
    InfrastructureService service,
    Set<CredentialsType> credentialsTypes,
    String scope,
    String email,
    NpmAuthMode authMode
) implements EnvironmentServiceDefinition {

    public NpmDefinition {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        credentialsTypes = credentialsTypes == null ? service.credentialsTypes() : Set.copyOf(credentialsTypes);
        authMode = authMode == null ? NpmAuthMode.PASSWORD : authMode;
    }
}
