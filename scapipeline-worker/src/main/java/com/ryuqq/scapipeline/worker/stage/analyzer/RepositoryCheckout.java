package com.ryuqq.scapipeline.worker.stage.analyzer;

import com.ryuqq.scapipeline.core.model.Repository;

import java.nio.file.Path;

/**
 * Obtains the source tree of a repository at a revision.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RepositoryCheckout {

    /**
     * Check out the repository.
     *
     * @param repository repository to check out
     * @param revision revision to check out
     * @param targetDirectory empty directory owned by the worker context
     * @return root of the checked out tree
     * @throws Exception if the checkout fails
     */
    Path checkout(Repository repository, String revision, Path targetDirectory) throws Exception;
}
