package com.ryuqq.scapipeline.adapter.inmemory.store;

import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.spi.SecretRepository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link SecretRepository}.
 *
 * <p>Secrets are listed in insertion order.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySecretRepository implements SecretRepository {

    private final List<Secret> secrets = new CopyOnWriteArrayList<>();

    public void add(Secret secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        secrets.add(secret);
    }

    @Override
    public List<Secret> listForRepository(long repositoryId) {
        return filter(secret -> secret.repositoryId() != null && secret.repositoryId() == repositoryId);
    }

    @Override
    public List<Secret> listForProduct(long productId) {
        return filter(secret -> secret.productId() != null && secret.productId() == productId);
    }

    @Override
    public List<Secret> listForOrganization(long organizationId) {
        return filter(secret -> secret.organizationId() != null && secret.organizationId() == organizationId);
    }

    private List<Secret> filter(Predicate<Secret> predicate) {
        return secrets.stream().filter(predicate).toList();
    }
}
