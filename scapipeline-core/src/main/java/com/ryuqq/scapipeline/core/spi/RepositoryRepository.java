package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.Hierarchy;

import java.util.Optional;

/**
 * Resolves the ownership chain of source repositories.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RepositoryRepository {

    /**
     * Returns the organization/product/repository chain of a repository.
     *
     * @param repositoryId the repository id
     * @return the hierarchy, or empty if the repository is unknown
     */
    Optional<Hierarchy> getHierarchy(long repositoryId);
}
