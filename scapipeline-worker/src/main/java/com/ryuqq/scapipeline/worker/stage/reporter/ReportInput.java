package com.ryuqq.scapipeline.worker.stage.reporter;

import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Run;

/**
 * Data available to report formats.
 *
 * @param run run being reported
 * @param hierarchy repository hierarchy of the run
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReportInput(Run run, Hierarchy hierarchy) {

    public ReportInput {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (hierarchy == null) {
            throw new IllegalArgumentException("hierarchy cannot be null");
        }
    }
}
