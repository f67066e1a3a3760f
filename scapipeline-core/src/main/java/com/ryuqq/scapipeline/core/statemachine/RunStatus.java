package com.ryuqq.scapipeline.core.statemachine;

/**
 * Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ├─► CANCELLED / FAILED
 *    │
 *    ▼ (생성 트리거 처리)
 * ACTIVE ── 단계별 진행 ──┐
 *    │                    │
 *    ├─► FINISHED (모든 단계 성공)
 *    ├─► FINISHED_WITH_ISSUES (모든 단계 성공, 기준 이상의 Issue 존재)
 *    ├─► FAILED (단계 실패)
 *    └─► CANCELLED (외부 취소)
 *
 * 종료 상태에서는 어떤 상태로도 전이 불가
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 생성됨 (아직 단계가 dispatch되지 않음).
     */
    CREATED,

    /**
     * 실행 중.
     */
    ACTIVE,

    /**
     * 모든 요청 단계 성공.
     */
    FINISHED,

    /**
     * 모든 요청 단계 성공, 기준 이상의 Issue가 기록됨.
     */
    FINISHED_WITH_ISSUES,

    /**
     * 단계 실패.
     */
    FAILED,

    /**
     * 외부 요청으로 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return CREATED, ACTIVE가 아니면 true
     */
    public boolean isTerminal() {
        return this != CREATED && this != ACTIVE;
    }
}
