package com.ryuqq.scapipeline.worker.environment;

/**
 * Environment configuration을 해석할 수 없는 경우 (strict 모드의 해석 불가 참조, 잘못된 파일 형식).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EnvironmentConfigException extends Exception {

    public EnvironmentConfigException(String message) {
        super(message);
    }

    public EnvironmentConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
