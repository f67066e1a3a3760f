/**
 * Runner Adapter.
 *
 * <p>Endpoint 처리 루프와 프로세스 launcher를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.scapipeline.adapter.runner.WorkerEndpointRunner}: 단계 worker 루프 (oneshot / loop)</li>
 *   <li>{@link com.ryuqq.scapipeline.adapter.runner.OrchestratorEndpointRunner}: Orchestrator 메시지 동시 처리</li>
 *   <li>{@link com.ryuqq.scapipeline.adapter.runner.WorkerLauncher}, {@link com.ryuqq.scapipeline.adapter.runner.OrchestratorLauncher}: 환경 변수 기반 구성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.adapter.runner;
