package com.ryuqq.scapipeline.adapter.runner;

import java.util.Map;

/**
 * WorkerEndpointRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mode: 실행 방식 (기본 LOOP)</li>
 *   <li>pollTimeoutMs: receive 1회 최대 대기 시간 (기본 1000ms)</li>
 * </ul>
 *
 * <p>환경 변수 {@value #MODE_VARIABLE}, {@value #POLL_TIMEOUT_VARIABLE}로 지정할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param mode 실행 방식
 * @param pollTimeoutMs receive 대기 시간 (밀리초, 0 이상)
 */
public record WorkerEndpointConfig(
    WorkerMode mode,
    long pollTimeoutMs
) {

    public static final String MODE_VARIABLE = "WORKER_MODE";
    public static final String POLL_TIMEOUT_VARIABLE = "WORKER_POLL_TIMEOUT_MS";

    private static final long DEFAULT_POLL_TIMEOUT_MS = 1000L;

    /**
     * 기본 설정 생성자 (LOOP, 1000ms).
     */
    public WorkerEndpointConfig() {
        this(WorkerMode.LOOP, DEFAULT_POLL_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerEndpointConfig {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (pollTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must not be negative (current: " + pollTimeoutMs + ")"
            );
        }
    }

    /**
     * 환경 변수에서 설정 읽기. 없는 항목은 기본값을 사용합니다.
     *
     * @param environment 환경 변수
     * @return 설정
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static WorkerEndpointConfig fromEnvironment(Map<String, String> environment) {
        WorkerEndpointConfig config = new WorkerEndpointConfig();
        String mode = environment.get(MODE_VARIABLE);
        if (mode != null && !mode.isBlank()) {
            config = config.withMode(WorkerMode.fromValue(mode));
        }
        String timeout = environment.get(POLL_TIMEOUT_VARIABLE);
        if (timeout != null && !timeout.isBlank()) {
            config = config.withPollTimeoutMs(parseLong(POLL_TIMEOUT_VARIABLE, timeout));
        }
        return config;
    }

    public WorkerEndpointConfig withMode(WorkerMode mode) {
        return new WorkerEndpointConfig(mode, pollTimeoutMs);
    }

    public WorkerEndpointConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new WorkerEndpointConfig(mode, pollTimeoutMs);
    }

    static long parseLong(String variable, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " must be a number, but was: '" + value + "'", e);
        }
    }
}
