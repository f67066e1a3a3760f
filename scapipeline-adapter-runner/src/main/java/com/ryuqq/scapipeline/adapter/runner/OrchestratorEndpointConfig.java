package com.ryuqq.scapipeline.adapter.runner;

import java.util.Map;

/**
 * OrchestratorEndpointRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 처리하는 메시지 수 (기본 4)</li>
 *   <li>pollTimeoutMs: receive 1회 최대 대기 시간 (기본 1000ms)</li>
 * </ul>
 *
 * <p>같은 Run의 메시지는 Orchestrator가 직렬화하므로 concurrency는 서로 다른 Run 사이의 병렬성만 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 동시 처리 수 (1 이상)
 * @param pollTimeoutMs receive 대기 시간 (밀리초, 0 이상)
 */
public record OrchestratorEndpointConfig(
    int concurrency,
    long pollTimeoutMs
) {

    public static final String CONCURRENCY_VARIABLE = "ORCHESTRATOR_CONCURRENCY";
    public static final String POLL_TIMEOUT_VARIABLE = "ORCHESTRATOR_POLL_TIMEOUT_MS";

    /**
     * 기본 설정 생성자 (concurrency=4, pollTimeoutMs=1000).
     */
    public OrchestratorEndpointConfig() {
        this(4, 1000L);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorEndpointConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
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
     */
    public static OrchestratorEndpointConfig fromEnvironment(Map<String, String> environment) {
        OrchestratorEndpointConfig config = new OrchestratorEndpointConfig();
        String concurrency = environment.get(CONCURRENCY_VARIABLE);
        if (concurrency != null && !concurrency.isBlank()) {
            config = config.withConcurrency((int) WorkerEndpointConfig.parseLong(CONCURRENCY_VARIABLE, concurrency));
        }
        String timeout = environment.get(POLL_TIMEOUT_VARIABLE);
        if (timeout != null && !timeout.isBlank()) {
            config = config.withPollTimeoutMs(WorkerEndpointConfig.parseLong(POLL_TIMEOUT_VARIABLE, timeout));
        }
        return config;
    }

    public OrchestratorEndpointConfig withConcurrency(int concurrency) {
        return new OrchestratorEndpointConfig(concurrency, pollTimeoutMs);
    }

    public OrchestratorEndpointConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new OrchestratorEndpointConfig(concurrency, pollTimeoutMs);
    }
}
