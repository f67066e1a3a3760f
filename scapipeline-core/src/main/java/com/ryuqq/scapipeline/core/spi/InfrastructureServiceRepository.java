package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.InfrastructureService;

import java.util.List;

/**
 * Lists infrastructure services declared at product and organization scope.
 *
 * <p>Repository-scope services are declared in the repository's environment configuration file.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InfrastructureServiceRepository {

    List<InfrastructureService> listForProduct(long productId);

    List<InfrastructureService> listForOrganization(long organizationId);
}
