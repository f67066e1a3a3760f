package com.ryuqq.scapipeline.core.spi;

import com.ryuqq.scapipeline.core.model.Run;

import java.util.Optional;

/**
 * Persistence of {@link Run}s.
 *
 * <p>The orchestrator serializes writes per run id; implementations only need to be safe for
 * concurrent access to different runs.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunRepository {

    /**
     * Looks up a run.
     *
     * @param runId the run id
     * @return the run, or empty if unknown
     */
    Optional<Run> get(long runId);

    /**
     * Stores a new run.
     *
     * @param run the run to store
     * @return the stored run
     * @throws IllegalArgumentException if a run with the same id already exists
     */
    Run create(Run run);

    /**
     * Replaces an existing run.
     *
     * @param run the new state of the run
     * @throws RunNotFoundException if no run with this id exists
     */
    void update(Run run);
}
