package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.Secret;

import java.util.List;

/**
 * Lists secret references declared at each hierarchy scope.
 *
 * <p>Only references are returned; values live in the {@link SecretStore}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SecretRepository {

    List<Secret> listForRepository(long repositoryId);

    List<Secret> listForProduct(long productId);

    List<Secret> listForOrganization(long organizationId);
}
