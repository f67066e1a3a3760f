package com.ryuqq.scapipeline.worker.stage.reporter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists generated report files outside the worker context.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReportStorage {

    /**
     * Store a report file.
     *
     * @param runId run the report belongs to
     * @param name report file name
     * @param file file to store, deleted when the context closes
     * @throws IOException if the file cannot be stored
     */
    void store(long runId, String name, Path file) throws IOException;
}
