package com.ryuqq.scapipeline.adapter.inmemory.store;

import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.spi.RunNotFoundException;
import com.ryuqq.scapipeline.core.spi.RunRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RunRepository} for testing and reference purposes.
 *
 * <p><strong>Limitations:</strong> data is lost on process restart.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRunRepository implements RunRepository {

    private final ConcurrentHashMap<Long, Run> runs = new ConcurrentHashMap<>();

    @Override
    public Optional<Run> get(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public Run create(Run run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        Run existing = runs.putIfAbsent(run.id(), run);
        if (existing != null) {
            throw new IllegalArgumentException("Run already exists: " + run.id());
        }
        return run;
    }

    @Override
    public void update(Run run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (runs.computeIfPresent(run.id(), (id, previous) -> run) == null) {
            throw new RunNotFoundException(run.id());
        }
    }

    public int size() {
        return runs.size();
    }

    public void clear() {
        runs.clear();
    }
}
