/**
 * Run 상태 머신.
 *
 * <p>{@link com.ryuqq.scapipeline.core.statemachine.RunStatus}는 상태 집합을,
 * {@link com.ryuqq.scapipeline.core.statemachine.RunStatusTransition}은 허용된 전이 규칙을 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.core.statemachine;
