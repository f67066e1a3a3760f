package com.ryuqq.scapipeline.adapter.inmemory.store;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.spi.RepositoryRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RepositoryRepository}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryHierarchyRepository implements RepositoryRepository {

    private final ConcurrentHashMap<Long, Hierarchy> hierarchies = new ConcurrentHashMap<>();

    /**
     * Register the hierarchy of a repository.
     *
     * @param hierarchy hierarchy keyed by its repository id
     */
    public void register(Hierarchy hierarchy) {
        if (hierarchy == null) {
            throw new IllegalArgumentException("hierarchy cannot be null");
        }
        hierarchies.put(hierarchy.repository().id(), hierarchy);
    }

    @Override
    public Optional<Hierarchy> getHierarchy(long repositoryId) {
        return Optional.ofNullable(hierarchies.get(repositoryId));
    }
}
