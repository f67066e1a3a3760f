/**
 * 해석/검증 결과 타입.
 *
 * <p>{@link com.ryuqq.scapipeline.core.outcome.Outcome}은 예외로 실패를 전달하는 대신
 * 실패를 값으로 반환하여, 여러 실패를 모아 한 번에 진단할 수 있게 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scapipeline.core.outcome;
