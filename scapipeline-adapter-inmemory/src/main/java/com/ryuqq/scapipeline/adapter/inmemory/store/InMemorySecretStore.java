package com.ryuqq.scapipeline.adapter.inmemory.store;

import com.ryuqq.scapipeline.core.model.SecretPath;
import com.ryuqq.scapipeline.core.spi.SecretStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link SecretStore}.
 *
 * <p>Counts reads so tests can assert on caching.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySecretStore implements SecretStore {

    private final ConcurrentHashMap<SecretPath, String> values = new ConcurrentHashMap<>();
    private final AtomicInteger reads = new AtomicInteger();

    @Override
    public Optional<String> readSecret(SecretPath path) {
        reads.incrementAndGet();
        return Optional.ofNullable(values.get(path));
    }

    @Override
    public void writeSecret(SecretPath path, String value) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        values.put(path, value);
    }

    public int readCount() {
        return reads.get();
    }
}
