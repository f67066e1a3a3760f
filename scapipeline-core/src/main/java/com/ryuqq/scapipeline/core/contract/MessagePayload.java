package com.ryuqq.scapipeline.core.contract;

/**
 * Endpoint payload의 최상위 타입.
 *
 * <p>단계 endpoint는 {@link JobRequest}를, Orchestrator endpoint는 {@link OrchestratorMessage}를 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface MessagePayload permits JobRequest, OrchestratorMessage {
}
