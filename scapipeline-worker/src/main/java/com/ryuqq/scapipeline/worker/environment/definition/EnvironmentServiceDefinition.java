package com.ryuqq.scapipeline.worker.environment.definition;

import com.ryuqq.scapipeline.core.model.CredentialsType;
import com.ryuqq.scapipeline.core.model.InfrastructureService;

import java.util.Set;

/**
 * Binds an {@link InfrastructureService} to a package manager specific configuration.
 *
 * <p>Each variant knows which configuration file it contributes to (Maven {@code settings.xml},
 * {@code .npmrc}, {@code NuGet.Config}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface EnvironmentServiceDefinition permits MavenDefinition, NpmDefinition, NuGetDefinition {

    /**
     * The referenced service.
     *
     * @return service
     */
    InfrastructureService service();

    /**
     * The ways in which the service credentials are exposed.
     *
     * <p>Defaults to the service's own credentials types when the definition does not override them.</p>
     *
     * @return credentials types
     */
    Set<CredentialsType> credentialsTypes();
}
