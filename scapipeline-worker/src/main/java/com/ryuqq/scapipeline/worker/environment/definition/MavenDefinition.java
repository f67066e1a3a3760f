package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;

import java.util.Set;

/**
 * A server entry in Maven's {@code settings.xml}.
 *
 * @param service referenced service
 * @param credentialsTypes credentials exposure
 * @param id server id matching the repository id in the POM
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MavenDefinition(
    InfrastructureService service,
    Set<CredentialsType> credentialsTypes,
    String id
) implements EnvironmentServiceDefinition {

    public MavenDefinition {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        credentialsTypes = credentialsTypes == null ? service.credentialsTypes() : Set.copyOf(credentialsTypes);
    }
}
