package com.ryuqq.scapipeline.worker.stage.config;

import com.ryuqq.scapipeline.core.contract.JobRequest.ConfigRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.JobResult.ConfigWorkerResult;
import com.ryuqq.scapipeline.core.contract.JobResult.WorkerError;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.spi.ConfigManager;
import com.ryuqq.scapipeline.worker.context.RunOverridingWorkerContext;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * CONFIG 단계 처리기.
 *
 * <p>처리 흐름:</p>
 * <ol>
 *   <li>Run의 설정 context를 {@link ConfigManager}로 해석</li>
 *   <li>해석된 context를 가진 Run으로 교체한 컨텍스트에서 {@link ConfigValidator} 실행</li>
 *   <li>성공: 해석된 job configuration, context, Issue를 담은 {@link ConfigWorkerResult}</li>
 *   <li>실패: 검증 Issue 메시지를 담은 {@link WorkerError}</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConfigWorker implements StageHandler<ConfigRequest> {

    private static final Logger log = LoggerFactory.getLogger(ConfigWorker.class);

    private final ConfigManager configManager;
    private final ConfigValidator validator;

    public ConfigWorker(ConfigManager configManager, ConfigValidator validator) {
        if (configManager == null) {
            throw new IllegalArgumentException("configManager cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.configManager = configManager;
        this.validator = validator;
    }

    @Override
    public Class<ConfigRequest> requestType() {
        return ConfigRequest.class;
    }

    @Override
    public JobResult handle(WorkerContext context, ConfigRequest request) throws Exception {
        Run run = context.getRun();
        String resolvedContext = configManager.resolveContext(run.jobConfigContext());
        log.info("Resolved configuration context of run {}: {} -> {}", run.id(), run.jobConfigContext(), resolvedContext);

        Run resolvedRun = run.withResolvedJobConfigs(run.resolvedJobConfigs(), resolvedContext);
        ConfigValidationResult result = validator.validate(
            new RunOverridingWorkerContext(context, resolvedRun),
            run.jobConfigs()
        );

        if (result instanceof ConfigValidationResult.Success success) {
            return new ConfigWorkerResult(run.id(), success.resolvedJobConfigs(), resolvedContext, success.issues());
        }

        String diagnostic = result.issues().stream()
            .map(Issue::message)
            .collect(Collectors.joining("; "));
        log.warn("Job configuration of run {} is invalid: {}", run.id(), diagnostic);
        return new WorkerError(PipelineStage.CONFIG, run.id(), "Invalid job configuration: " + diagnostic);
    }
}
