package com.ryuqq.scapipeline.core.contract;

import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.PipelineStage;

import java.util.List;

/**
 * Worker가 Orchestrator로 보내는 단계 결과.
 *
 * <p>단계마다 성공 variant가 하나씩 있고, 모든 단계가 공유하는 실패 variant {@link WorkerError}가 있습니다.
 * 성공 결과는 단계에서 기록한 Issue를 함께 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface JobResult extends OrchestratorMessage {

    /**
     * 결과를 보낸 단계.
     *
     * @return 단계
     */
    PipelineStage stage();

    /**
     * 단계에서 기록한 Issue.
     *
     * @return Issue 목록 (없으면 빈 목록)
     */
    List<Issue> issues();

    /**
     * 실패 결과인지 확인.
     *
     * @return WorkerError이면 true
     */
    default boolean failed() {
        return this instanceof WorkerError;
    }

    /**
     * 추가 데이터가 없는 단계의 성공 결과 생성.
     *
     * @param stage 단계 (CONFIG 제외)
     * @param runId Run ID
     * @param issues 기록된 Issue
     * @return 단계별 성공 결과
     * @throws IllegalArgumentException stage가 null이거나 CONFIG인 경우
     */
    static JobResult success(PipelineStage stage, long runId, List<Issue> issues) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return switch (stage) {
            case CONFIG -> throw new IllegalArgumentException("Config results must carry resolved configurations");
            case ANALYZER -> new AnalyzerWorkerResult(runId, issues);
            case ADVISOR -> new AdvisorWorkerResult(runId, issues);
            case SCANNER -> new ScannerWorkerResult(runId, issues);
            case EVALUATOR -> new EvaluatorWorkerResult(runId, issues);
            case REPORTER -> new ReporterWorkerResult(runId, List.of(), issues);
            case NOTIFIER -> new NotifierWorkerResult(runId, issues);
        };
    }

    /**
     * CONFIG 단계 결과.
     *
     * @param runId Run ID
     * @param resolvedJobConfigs 해석된 job configuration
     * @param resolvedJobConfigContext 해석된 설정 context (null 가능)
     * @param issues 검증 Issue
     */
    record ConfigWorkerResult(
        long runId,
        JobConfigurations resolvedJobConfigs,
        String resolvedJobConfigContext,
        List<Issue> issues
    ) implements JobResult {

        public ConfigWorkerResult {
            if (resolvedJobConfigs == null) {
                throw new IllegalArgumentException("resolvedJobConfigs cannot be null");
            }
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.CONFIG;
        }
    }

    record AnalyzerWorkerResult(long runId, List<Issue> issues) implements JobResult {

        public AnalyzerWorkerResult {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.ANALYZER;
        }
    }

    record AdvisorWorkerResult(long runId, List<Issue> issues) implements JobResult {

        public AdvisorWorkerResult {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.ADVISOR;
        }
    }

    record ScannerWorkerResult(long runId, List<Issue> issues) implements JobResult {

        public ScannerWorkerResult {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.SCANNER;
        }
    }

    record EvaluatorWorkerResult(long runId, List<Issue> issues) implements JobResult {

        public EvaluatorWorkerResult {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.EVALUATOR;
        }
    }

    /**
     * REPORTER 단계 결과.
     *
     * @param runId Run ID
     * @param reportNames 저장된 보고서 파일 이름
     * @param issues 기록된 Issue
     */
    record ReporterWorkerResult(long runId, List<String> reportNames, List<Issue> issues) implements JobResult {

        public ReporterWorkerResult {
            reportNames = reportNames == null ? List.of() : List.copyOf(reportNames);
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.REPORTER;
        }
    }

    record NotifierWorkerResult(long runId, List<Issue> issues) implements JobResult {

        public NotifierWorkerResult {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public PipelineStage stage() {
            return PipelineStage.NOTIFIER;
        }
    }

    /**
     * 단계 실패 결과.
     *
     * <p>message는 사람이 읽을 수 있는 진단이며 stack trace를 포함하지 않습니다.</p>
     *
     * @param stage 실패한 단계
     * @param runId Run ID
     * @param message 진단 메시지
     */
    record WorkerError(PipelineStage stage, long runId, String message) implements JobResult {

        public WorkerError {
            if (stage == null) {
                throw new IllegalArgumentException("stage cannot be null");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }

        @Override
        public List<Issue> issues() {
            return List.of();
        }
    }
}
