package com.ryuqq.scapipeline.core.model;

/**
 * Issue 심각도.
 *
 * <p>선언 순서가 곧 심각도 순서입니다 (HINT &lt; WARNING &lt; ERROR).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Severity {

    /**
     * 참고용 메시지.
     */
    HINT,

    /**
     * 실행은 계속되지만 결과에 영향을 줄 수 있는 문제.
     */
    WARNING,

    /**
     * 단계 실패 또는 결과 누락을 일으킨 문제.
     */
    ERROR;

    /**
     * 이 심각도가 주어진 기준 이상인지 확인.
     *
     * @param threshold 비교 기준
     * @return threshold 이상이면 true
     * @throws IllegalArgumentException threshold가 null인 경우
     */
    public boolean isAtLeast(Severity threshold) {
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        return compareTo(threshold) >= 0;
    }
}
