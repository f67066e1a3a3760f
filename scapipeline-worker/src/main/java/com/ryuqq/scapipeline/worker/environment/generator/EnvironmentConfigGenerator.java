package com.ryuqq.scapipeline.worker.environment.generator;

import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentServiceDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one package manager configuration file from the definitions of one type.
 *
 * @param <T> definition type handled
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EnvironmentConfigGenerator<T extends EnvironmentServiceDefinition> {

    /**
     * Definition type this generator handles.
     *
     * @return definition class
     */
    Class<T> definitionType();

    /**
     * Write the configuration file.
     *
     * @param context context used to resolve service credentials
     * @param configDirectory directory receiving the file
     * @param definitions definitions of {@link #definitionType()}, never empty
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    GeneratedFile generate(WorkerContext context, Path configDirectory, List<T> definitions) throws IOException;
}
