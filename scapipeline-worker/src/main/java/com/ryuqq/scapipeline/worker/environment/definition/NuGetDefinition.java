package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;

import java.util.Set;

/**
 * A package source in {@code NuGet.Config}.
 *
 * @param service referenced service
 * @param credentialsTypes credentials exposure
 * @param sourceName package source key
 * @param sourcePath package source URL
 * @param sourceProtocolVersion protocol version (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NuGetDefinition(
    InfrastructureService service,
    Set<CredentialsType> credentialsTypes,
    String sourceName,
    String sourcePath,
    String sourceProtocolVersion
) implements EnvironmentServiceDefinition {

    public NuGetDefinition {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName cannot be null or blank");
        }
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("sourcePath cannot be null or blank");
        }
        credentialsTypes = credentialsTypes == null ? service.credentialsTypes() : Set.copyOf(credentialsTypes);
    }
}
