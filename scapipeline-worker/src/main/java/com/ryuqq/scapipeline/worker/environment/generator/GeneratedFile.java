package com.ryuqq.scapipeline.worker.environment.generator;

import java.nio.file.Path;
import java.util.Map;

/**
 * A written configuration file and the environment variables pointing tools at it.
 *
 * @param file written file
 * @param variables environment variables to set
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GeneratedFile(Path file, Map<String, String> variables) {

    public GeneratedFile {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
