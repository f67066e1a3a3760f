package com.ryuqq.scapipeline.core.contract;

/**
 * Orchestrator endpoint가 받는 메시지.
 *
 * <p>Run 생성 트리거({@link CreateRun}), 취소 요청({@link CancelRun}),
 * 단계 결과({@link JobResult}) 중 하나입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface OrchestratorMessage extends MessagePayload permits CreateRun, CancelRun, JobResult {

    /**
     * 대상 Run ID.
     *
     * @return Run ID
     */
    long runId();
}
