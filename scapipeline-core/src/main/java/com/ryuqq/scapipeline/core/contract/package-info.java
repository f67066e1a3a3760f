/**
 * Endpoint 메시지 계약.
 *
 * <p>{@link com.ryuqq.scapipeline.core.contract.Envelope}는 header와 typed payload로 구성되며,
 * payload는 (단계, 요청|결과) 쌍마다 정확히 하나의 variant를 가집니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.scapipeline.core.contract.JobRequest} - Orchestrator → 단계 worker</li>
 *   <li>{@link com.ryuqq.scapipeline.core.contract.JobResult} - 단계 worker → Orchestrator</li>
 *   <li>{@link com.ryuqq.scapipeline.core.contract.CreateRun}, {@link com.ryuqq.scapipeline.core.contract.CancelRun} - 외부 → Orchestrator</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.core.contract;
