package com.ryuqq.scapipeline.core.spi;

/**
 * Thrown when a run id does not refer to a stored run.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunNotFoundException extends RuntimeException {

    private final long runId;

    public RunNotFoundException(long runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
