/**
 * Run 오케스트레이션.
 *
 * <p>{@link com.ryuqq.scapipeline.application.orchestrator.Orchestrator}는 단계 결과를 받아 Run 상태를
 * 전이하고 다음 단계를 dispatch합니다. 같은 Run의 전이는 직렬화되고, 서로 다른 Run은 동시에 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.application.orchestrator;
