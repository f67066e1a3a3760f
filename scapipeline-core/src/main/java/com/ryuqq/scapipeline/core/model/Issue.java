package com.ryuqq.scapipeline.core.model;

import java.time.Instant;

/**
 * Run 실행 중 기록된 문제.
 *
 * <p>Worker가 단계 결과와 함께 보고하거나, Orchestrator가 실패 진단 메시지로 추가합니다.
 * 한 번 기록된 Issue는 변경되지 않습니다.</p>
 *
 * @param timestamp 기록 시각
 * @param source 발생 위치 (예: 단계 이름, 플러그인 이름)
 * @param message 사람이 읽을 수 있는 진단 메시지
 * @param severity 심각도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Issue(
    Instant timestamp,
    String source,
    String message,
    Severity severity
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 source/message가 빈 문자열인 경우
     */
    public Issue {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
    }

    /**
     * 현재 시각으로 Issue 생성.
     *
     * @param source 발생 위치
     * @param message 진단 메시지
     * @param severity 심각도
     * @return 생성된 Issue
     */
    public static Issue of(String source, String message, Severity severity) {
        return new Issue(Instant.now(), source, message, severity);
    }
}
