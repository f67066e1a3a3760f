package com.ryuqq.scapipeline.worker.stage.reporter;

import com.ryuqq.scapipeline.core.model.PluginConfiguration;

import java.nio.file.Path;
import java.util.List;

/**
 * A report format selectable in the reporter job configuration.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} by
 * {@link ReportFormatRegistry#load()} or registered explicitly.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ReportFormat {

    /**
     * Name used in the reporter job configuration.
     *
     * @return unique format name
     */
    String name();

    /**
     * Write the report files.
     *
     * @param input report data
     * @param outputDirectory empty directory receiving the files
     * @param configuration options and resolved secrets of this format
     * @return written files
     * @throws Exception if the report cannot be generated
     */
    List<Path> generate(ReportInput input, Path outputDirectory, PluginConfiguration configuration) throws Exception;
}
