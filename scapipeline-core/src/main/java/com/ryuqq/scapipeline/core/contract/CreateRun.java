package com.ryuqq.scapipeline.core.contract;

/**
 * Run 생성 트리거.
 *
 * <p>Run은 이미 CREATED 상태로 저장되어 있어야 합니다. Orchestrator는 이 메시지를 받아
 * Run을 ACTIVE로 전이하고 CONFIG 단계를 dispatch합니다.</p>
 *
 * @param runId 생성된 Run ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CreateRun(long runId) implements OrchestratorMessage {
}
