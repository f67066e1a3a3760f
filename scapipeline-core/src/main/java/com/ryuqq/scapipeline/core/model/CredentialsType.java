package com.ryuqq.scapipeline.core.model;

/**
 * Infrastructure service 자격 증명을 노출하는 방식.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CredentialsType {

    /**
     * {@code .netrc} 파일에 기록.
     */
    NETRC_FILE,

    /**
     * Git credentials 파일에 기록.
     */
    GIT_CREDENTIALS_FILE
}
