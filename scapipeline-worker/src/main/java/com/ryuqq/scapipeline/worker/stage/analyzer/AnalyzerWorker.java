package com.ryuqq.scapipeline.worker.stage.analyzer;

import com.ryuqq.scapipeline.core.contract.JobRequest.AnalyzerRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.JobResult.AnalyzerWorkerResult;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.model.StageConfiguration;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.EnvironmentConfigLoader;
import com.ryuqq.scapipeline.worker.environment.EnvironmentService;
import com.ryuqq.scapipeline.worker.environment.EnvironmentSetup;
import com.ryuqq.scapipeline.worker.environment.ResolvedEnvironmentConfig;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ANALYZER 단계 처리기.
 *
 * <p>처리 흐름:</p>
 * <ol>
 *   <li>컨텍스트 임시 디렉터리에 저장소 체크아웃</li>
 *   <li>{@value EnvironmentConfigLoader#CONFIG_FILE_PATH} 해석 (strict 실패는 예외로 전파)</li>
 *   <li>lenient 경고는 WARNING Issue로 기록</li>
 *   <li>환경 준비 후 {@link DependencyAnalyzer} 실행</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AnalyzerWorker implements StageHandler<AnalyzerRequest> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerWorker.class);

    private final RepositoryCheckout checkout;
    private final EnvironmentConfigLoader environmentConfigLoader;
    private final EnvironmentService environmentService;
    private final DependencyAnalyzer analyzer;

    public AnalyzerWorker(
        RepositoryCheckout checkout,
        EnvironmentConfigLoader environmentConfigLoader,
        EnvironmentService environmentService,
        DependencyAnalyzer analyzer
    ) {
        if (checkout == null) {
            throw new IllegalArgumentException("checkout cannot be null");
        }
        if (environmentConfigLoader == null) {
            throw new IllegalArgumentException("environmentConfigLoader cannot be null");
        }
        if (environmentService == null) {
            throw new IllegalArgumentException("environmentService cannot be null");
        }
        if (analyzer == null) {
            throw new IllegalArgumentException("analyzer cannot be null");
        }
        this.checkout = checkout;
        this.environmentConfigLoader = environmentConfigLoader;
        this.environmentService = environmentService;
        this.analyzer = analyzer;
    }

    @Override
    public Class<AnalyzerRequest> requestType() {
        return AnalyzerRequest.class;
    }

    @Override
    public JobResult handle(WorkerContext context, AnalyzerRequest request) throws Exception {
        Run run = context.getRun();
        Hierarchy hierarchy = context.getHierarchy();
        StageConfiguration configuration = run.effectiveJobConfigs()
            .forStage(PipelineStage.ANALYZER)
            .orElse(StageConfiguration.defaults());

        Path repositoryDirectory = checkout.checkout(hierarchy.repository(), run.revision(), context.createTempDir());
        log.info("Checked out {} at {} for run {}", hierarchy.repository().url(), run.revision(), run.id());

        ResolvedEnvironmentConfig environmentConfig = environmentConfigLoader.parse(repositoryDirectory, hierarchy);

        List<Issue> issues = new ArrayList<>();
        for (String warning : environmentConfig.warnings()) {
            issues.add(Issue.of(PipelineStage.ANALYZER.endpointName(), warning.strip(), Severity.WARNING));
        }

        EnvironmentSetup setup = environmentService.setup(context, environmentConfig);
        issues.addAll(analyzer.analyze(repositoryDirectory, setup.variables(), configuration));

        log.info("Analysis of run {} finished with {} issue(s)", run.id(), issues.size());
        return new AnalyzerWorkerResult(run.id(), issues);
    }
}
