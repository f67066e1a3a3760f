package com.ryuqq.scapipeline.worker.stage.analyzer;

import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.StageConfiguration;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Analyzes the dependencies of a checked out repository.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DependencyAnalyzer {

    /**
     * Run the analysis.
     *
     * @param repositoryDirectory checked out repository root
     * @param environment environment variables prepared for the analysis process
     * @param configuration analyzer stage configuration
     * @return issues found during the analysis
     * @throws Exception if the analysis cannot be executed
     */
    List<Issue> analyze(Path repositoryDirectory, Map<String, String> environment, StageConfiguration configuration)
        throws Exception;
}
