package com.ryuqq.scapipeline.worker.stage.reporter;

import com.ryuqq.scapipeline.core.contract.JobRequest.ReporterRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.JobResult.ReporterWorkerResult;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.model.StageConfiguration;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REPORTER 단계 처리기.
 *
 * <p>reporter job configuration에 활성화된 포맷마다 보고서를 생성해 {@link ReportStorage}에 저장합니다.
 * 알 수 없는 포맷이나 개별 포맷의 생성 실패는 ERROR Issue로 기록되고 나머지 포맷은 계속 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReporterWorker implements StageHandler<ReporterRequest> {

    private static final Logger log = LoggerFactory.getLogger(ReporterWorker.class);

    private static final String ISSUE_SOURCE = PipelineStage.REPORTER.endpointName();

    private final ReportFormatRegistry registry;
    private final ReportStorage storage;

    public ReporterWorker(ReportFormatRegistry registry, ReportStorage storage) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.registry = registry;
        this.storage = storage;
    }

    @Override
    public Class<ReporterRequest> requestType() {
        return ReporterRequest.class;
    }

    @Override
    public JobResult handle(WorkerContext context, ReporterRequest request) throws Exception {
        Run run = context.getRun();
        StageConfiguration configuration = run.effectiveJobConfigs()
            .forStage(PipelineStage.REPORTER)
            .orElse(StageConfiguration.defaults());
        Map<String, PluginConfiguration> pluginConfigs =
            context.resolvePluginConfigSecrets(configuration.pluginConfigs());
        ReportInput input = new ReportInput(run, context.getHierarchy());
        Path outputDirectory = context.createTempDir();

        List<String> reportNames = new ArrayList<>();
        List<Issue> issues = new ArrayList<>();

        for (String formatName : configuration.enabledPlugins()) {
            Optional<ReportFormat> format = registry.find(formatName);
            if (format.isEmpty()) {
                issues.add(Issue.of(
                    ISSUE_SOURCE,
                    "Unknown report format: '" + formatName + "'. Available formats: " + registry.names(),
                    Severity.ERROR
                ));
                continue;
            }

            try {
                Path formatDirectory = Files.createDirectories(outputDirectory.resolve(formatName));
                PluginConfiguration pluginConfig = pluginConfigs.getOrDefault(formatName, new PluginConfiguration(null, null));
                for (Path file : format.get().generate(input, formatDirectory, pluginConfig)) {
                    String name = file.getFileName().toString();
                    storage.store(run.id(), name, file);
                    reportNames.add(name);
                }
            } catch (Exception e) {
                log.error("Report format '{}' failed for run {}", formatName, run.id(), e);
                issues.add(Issue.of(
                    ISSUE_SOURCE,
                    "Failed to generate report '" + formatName + "': " + e.getMessage(),
                    Severity.ERROR
                ));
            }
        }

        log.info("Generated {} report(s) for run {}", reportNames.size(), run.id());
        return new ReporterWorkerResult(run.id(), reportNames, issues);
    }
}
