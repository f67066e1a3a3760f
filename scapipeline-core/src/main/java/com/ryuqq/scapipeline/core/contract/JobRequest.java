package com.ryuqq.scapipeline.core.contract;

import com.ryuqq.scapipeline.core.model.PipelineStage;

/**
 * 단계 worker로 보내는 job request.
 *
 * <p>단계마다 정확히 하나의 variant가 있으며, 모두 대상 Run ID만 담습니다.
 * Worker는 Run ID로 나머지 정보를 조회합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface JobRequest extends MessagePayload {

    /**
     * 대상 Run ID.
     *
     * @return Run ID
     */
    long runId();

    /**
     * 이 요청을 처리할 단계.
     *
     * @return 단계
     */
    PipelineStage stage();

    /**
     * 단계에 맞는 요청 생성.
     *
     * @param stage 단계
     * @param runId Run ID
     * @return 단계별 JobRequest
     * @throws IllegalArgumentException stage가 null인 경우
     */
    static JobRequest forStage(PipelineStage stage, long runId) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return switch (stage) {
            case CONFIG -> new ConfigRequest(runId);
            case ANALYZER -> new AnalyzerRequest(runId);
            case ADVISOR -> new AdvisorRequest(runId);
            case SCANNER -> new ScannerRequest(runId);
            case EVALUATOR -> new EvaluatorRequest(runId);
            case REPORTER -> new ReporterRequest(runId);
            case NOTIFIER -> new NotifierRequest(runId);
        };
    }

    record ConfigRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.CONFIG;
        }
    }

    record AnalyzerRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.ANALYZER;
        }
    }

    record AdvisorRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.ADVISOR;
        }
    }

    record ScannerRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.SCANNER;
        }
    }

    record EvaluatorRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.EVALUATOR;
        }
    }

    record ReporterRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.REPORTER;
        }
    }

    record NotifierRequest(long runId) implements JobRequest {
        @Override
        public PipelineStage stage() {
            return PipelineStage.NOTIFIER;
        }
    }
}
