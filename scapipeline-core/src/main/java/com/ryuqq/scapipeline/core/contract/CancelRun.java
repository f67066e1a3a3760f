package com.ryuqq.scapipeline.core.contract;

/**
 * Run 취소 요청.
 *
 * @param runId 취소할 Run ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CancelRun(long runId) implements OrchestratorMessage {
}
