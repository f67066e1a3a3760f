package com.ryuqq.scapipeline.adapter.runner;

import java.util.Locale;

/**
 * Worker 프로세스 실행 방식.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkerMode {

    /**
     * 메시지 하나를 처리한 뒤 종료 (scale-to-zero 실행).
     */
    ONESHOT("oneshot"),

    /**
     * 중지될 때까지 계속 처리 (상주 pool 멤버).
     */
    LOOP("loop");

    private final String value;

    WorkerMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 설정 값으로 모드 조회 (대소문자 무시).
     *
     * @param value {@code oneshot} 또는 {@code loop}
     * @return WorkerMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static WorkerMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkerMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown worker mode: '" + value + "' (expected oneshot or loop)");
    }
}
